package org.surveyworkbench.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.surveyworkbench.models.dto.WorkbenchConfiguration;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class ConfigurationService {

    private static final TypeReference<LinkedHashMap<String, WorkbenchConfiguration>> CONFIGURATIONS =
            new TypeReference<>() {
            };

    private final ObjectMapper objectMapper;
    private final Path configurationFile;

    public ConfigurationService(ObjectMapper objectMapper,
                                @Value("${workbench.configurations.file:}") String configurationFile) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        if (StringUtils.hasText(configurationFile)) {
            this.configurationFile = Paths.get(configurationFile).toAbsolutePath().normalize();
        } else {
            this.configurationFile = Paths.get("config.json").toAbsolutePath().normalize();
        }
    }

    public List<String> listNames() {
        return List.copyOf(readAll().keySet());
    }

    public WorkbenchConfiguration load(String name) {
        WorkbenchConfiguration configuration = readAll().get(name);
        if (configuration == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Configuration '" + name + "' not found!");
        }
        return configuration;
    }

    public WorkbenchConfiguration save(String name, WorkbenchConfiguration configuration) {
        String configurationName = InputValidator.requireText(name, "No configuration name provided!");
        WorkbenchConfiguration named = new WorkbenchConfiguration(configurationName,
                configuration.targetPath(),
                configuration.questionnaires() == null ? List.of() : configuration.questionnaires(),
                configuration.sourcePath(),
                configuration.masterfilePath());

        Map<String, WorkbenchConfiguration> all = readAll();
        all.remove(configurationName);
        all.put(configurationName, named);
        writeAll(all);
        log.info("Configuration '{}' saved", configurationName);
        return named;
    }

    public void delete(String name) {
        Map<String, WorkbenchConfiguration> all = readAll();
        if (all.remove(name) == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Configuration '" + name + "' not found!");
        }
        writeAll(all);
        log.info("Configuration '{}' deleted", name);
    }

    private Map<String, WorkbenchConfiguration> readAll() {
        if (!Files.exists(configurationFile)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, WorkbenchConfiguration> all = objectMapper.readValue(configurationFile.toFile(), CONFIGURATIONS);
            return all == null ? new LinkedHashMap<>() : all;
        } catch (IOException ioException) {
            throw new IllegalStateException("Error loading configuration: " + ioException.getMessage(), ioException);
        }
    }

    private void writeAll(Map<String, WorkbenchConfiguration> all) {
        try {
            if (configurationFile.getParent() != null) {
                Files.createDirectories(configurationFile.getParent());
            }
            objectMapper.writeValue(configurationFile.toFile(), all);
        } catch (IOException ioException) {
            throw new IllegalStateException("Error saving configuration: " + ioException.getMessage(), ioException);
        }
    }
}
