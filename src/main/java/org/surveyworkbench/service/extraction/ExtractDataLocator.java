package org.surveyworkbench.service.extraction;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Component
public class ExtractDataLocator {

    public static final String DEFAULT_SUFFIX = "_Extract Data.csv";

    private final String suffix;

    public ExtractDataLocator(@Value("${workbench.extract.suffix:" + DEFAULT_SUFFIX + "}") String suffix) {
        this.suffix = suffix;
    }

    public Path participantFolder(Path sourceFolder, String participantId) {
        return sourceFolder.resolve(participantId);
    }

    public List<Path> locate(Path participantFolder) {
        try (Stream<Path> stream = Files.list(participantFolder)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(suffix))
                    .sorted((left, right) -> left.getFileName().toString().compareTo(right.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to list participant folder: " + participantFolder, ioException);
        }
    }

    // <participant_id>_<survey>_Extract Data.csv
    public String surveyName(String participantId, Path file) {
        String name = file.getFileName().toString();
        String prefix = participantId + "_";
        if (name.startsWith(prefix)) {
            name = name.substring(prefix.length());
        }
        if (name.endsWith(suffix)) {
            name = name.substring(0, name.length() - suffix.length());
        }
        return name;
    }
}
