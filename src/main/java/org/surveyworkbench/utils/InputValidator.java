package org.surveyworkbench.utils;

import org.springframework.util.StringUtils;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Checks user input before any filesystem mutation. Failures are {@link IllegalArgumentException}s
 * carrying the message shown to the user.
 */
public final class InputValidator {

    private InputValidator() {
    }

    public static String requireText(String value, String message) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException(message);
        }
        return value.trim();
    }

    public static Path requirePath(String value, String message) {
        String text = requireText(value, message);
        try {
            return Paths.get(text).toAbsolutePath().normalize();
        } catch (InvalidPathException exception) {
            throw new IllegalArgumentException("Invalid path: " + text, exception);
        }
    }

    public static String requireSegment(String value, String message) {
        String text = requireText(value, message);
        if (text.contains("/") || text.contains("\\") || text.equals(".") || text.equals("..")) {
            throw new IllegalArgumentException("Invalid name '" + text + "': path separators are not allowed");
        }
        return text;
    }
}
