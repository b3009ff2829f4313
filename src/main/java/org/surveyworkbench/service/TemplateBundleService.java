package org.surveyworkbench.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.surveyworkbench.models.dto.QuestionnaireSpec;
import org.surveyworkbench.models.dto.TemplateBundle;
import org.surveyworkbench.models.dto.TemplateBundleEntry;
import org.surveyworkbench.utils.InputValidator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reusable questionnaire configurations stored as {@code <root>/<name>.json}.
 */
@Slf4j
@Service
public class TemplateBundleService {

    private static final String BUNDLE_EXTENSION = ".json";

    private final ObjectMapper objectMapper;
    private final Path rootDirectory;

    public TemplateBundleService(ObjectMapper objectMapper,
                                 @Value("${workbench.bundles.root:}") String rootDirectory) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        if (StringUtils.hasText(rootDirectory)) {
            this.rootDirectory = Paths.get(rootDirectory).toAbsolutePath().normalize();
        } else {
            this.rootDirectory = Paths.get("template_bundles").toAbsolutePath().normalize();
        }
    }

    public List<String> listBundles() {
        if (!Files.isDirectory(rootDirectory)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(rootDirectory)) {
            return stream
                    .map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(BUNDLE_EXTENSION))
                    .map(name -> name.substring(0, name.length() - BUNDLE_EXTENSION.length()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ioException) {
            throw new IllegalStateException("Failed to list template bundles", ioException);
        }
    }

    public TemplateBundle load(String name) {
        Path file = bundleFile(name);
        if (!Files.exists(file)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Template bundle '" + name + "' not found");
        }
        try {
            TemplateBundle bundle = objectMapper.readValue(file.toFile(), TemplateBundle.class);
            log.info("Template bundle '{}' loaded ({} questionnaires)", name, bundle.questionnaireCount());
            return bundle;
        } catch (IOException ioException) {
            throw new IllegalStateException("Error loading template bundle: " + ioException.getMessage(), ioException);
        }
    }

    public List<QuestionnaireSpec> questionnaires(TemplateBundle bundle) {
        List<QuestionnaireSpec> rows = new ArrayList<>();
        for (int i = 0; i < bundle.questionnaireCount(); i++) {
            rows.add(new QuestionnaireSpec("", "", 1));
        }
        if (bundle.questionnaires() != null) {
            for (TemplateBundleEntry entry : bundle.questionnaires()) {
                if (entry.index() >= 0 && entry.index() < rows.size()) {
                    rows.set(entry.index(), entry.toQuestionnaire());
                }
            }
        }
        return rows;
    }

    public TemplateBundle save(String name, List<QuestionnaireSpec> questionnaires, boolean overwrite) {
        String bundleName = InputValidator.requireSegment(name, "Please enter a name for this template bundle!");
        if (questionnaires == null || questionnaires.isEmpty()) {
            throw new IllegalArgumentException("No questionnaire configuration to save!");
        }
        Path file = bundleFile(bundleName);
        if (Files.exists(file) && !overwrite) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Template bundle '" + bundleName + "' already exists");
        }

        List<TemplateBundleEntry> entries = new ArrayList<>();
        for (int i = 0; i < questionnaires.size(); i++) {
            QuestionnaireSpec spec = questionnaires.get(i);
            entries.add(new TemplateBundleEntry(i, spec.name(), spec.templatePath(),
                    spec.copyCount() == null ? 1 : spec.copyCount()));
        }
        TemplateBundle bundle = new TemplateBundle(bundleName, entries.size(), entries);

        try {
            Files.createDirectories(rootDirectory);
            objectMapper.writeValue(file.toFile(), bundle);
        } catch (IOException ioException) {
            throw new IllegalStateException("Error saving template bundle: " + ioException.getMessage(), ioException);
        }
        log.info("Template bundle '{}' saved to {}", bundleName, file);
        return bundle;
    }

    public void delete(String name) {
        Path file = bundleFile(name);
        try {
            if (!Files.deleteIfExists(file)) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Template bundle '" + name + "' not found");
            }
        } catch (IOException ioException) {
            throw new IllegalStateException("Error deleting template bundle: " + ioException.getMessage(), ioException);
        }
        log.info("Template bundle '{}' deleted", name);
    }

    private Path bundleFile(String name) {
        String bundleName = InputValidator.requireSegment(name, "Please enter a name for this template bundle!");
        return rootDirectory.resolve(bundleName + BUNDLE_EXTENSION);
    }
}
