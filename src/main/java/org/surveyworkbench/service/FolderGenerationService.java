package org.surveyworkbench.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.surveyworkbench.models.dto.BatchResult;
import org.surveyworkbench.models.dto.FolderGenerationResult;
import org.surveyworkbench.models.dto.QuestionnaireSpec;
import org.surveyworkbench.utils.InputValidator;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FolderGenerationService {

    private final ParticipantListService participantListService;

    public FolderGenerationResult generate(String participantId, String targetPath, List<QuestionnaireSpec> questionnaires) {
        String id = InputValidator.requireSegment(participantId, "Please enter a participant ID!");
        Path target = InputValidator.requirePath(targetPath, "Please select a target folder!");
        List<QuestionnaireSpec> specs = requireQuestionnaires(questionnaires);
        return generateFolder(id, target, specs);
    }

    public BatchResult generateBatch(String participantIds, String targetPath, List<QuestionnaireSpec> questionnaires) {
        List<String> ids = participantListService.parse(participantIds);
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("Please enter at least one participant ID!");
        }
        Path target = InputValidator.requirePath(targetPath, "Please select a target folder!");
        List<QuestionnaireSpec> specs = requireQuestionnaires(questionnaires);

        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (String id : ids) {
            try {
                generateFolder(InputValidator.requireSegment(id, "Please enter a participant ID!"), target, specs);
                succeeded.add(id);
            } catch (Exception exception) {
                log.error("Folder generation failed for participant {}", id, exception);
                failed.add(id + ": " + exception.getMessage());
            }
        }
        log.info("Generated {} of {} folders in {}", succeeded.size(), ids.size(), target);
        return new BatchResult(ids.size(), succeeded, List.of(), List.of(), failed, null);
    }

    /**
     * {@code <id>_<name><ext>} for a single copy, {@code <id>_<name><n><ext>} numbered from 1 otherwise.
     */
    static String copyName(String participantId, String surveyName, int copy, int copyCount, String extension) {
        if (copyCount == 1) {
            return participantId + "_" + surveyName + extension;
        }
        return participantId + "_" + surveyName + copy + extension;
    }

    private FolderGenerationResult generateFolder(String participantId, Path target, List<QuestionnaireSpec> specs) {
        Path participantFolder = target.resolve(participantId);
        List<String> files = new ArrayList<>();
        try {
            if (Files.exists(participantFolder)) {
                FileSystemUtils.deleteRecursively(participantFolder);
            }
            Files.createDirectories(participantFolder);

            for (int index = 0; index < specs.size(); index++) {
                QuestionnaireSpec spec = specs.get(index);
                if (!StringUtils.hasText(spec.templatePath())) {
                    continue;
                }
                Path template = Paths.get(spec.templatePath().trim());
                String surveyName = surveyName(spec, index);
                int copyCount = copyCount(spec);
                String extension = extension(template);

                for (int copy = 1; copy <= copyCount; copy++) {
                    String filename = copyName(participantId, surveyName, copy, copyCount, extension);
                    Files.copy(template, participantFolder.resolve(filename),
                            StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                    files.add(filename);
                }
            }
        } catch (IOException ioException) {
            throw new IllegalStateException("Error generating folder: " + ioException.getMessage(), ioException);
        }
        log.info("Participant folder created: {} ({} file(s))", participantFolder, files.size());
        return new FolderGenerationResult(participantId, participantFolder.toString(), files);
    }

    private List<QuestionnaireSpec> requireQuestionnaires(List<QuestionnaireSpec> questionnaires) {
        if (questionnaires == null || questionnaires.isEmpty()) {
            throw new IllegalArgumentException("Please configure questionnaires!");
        }
        for (QuestionnaireSpec spec : questionnaires) {
            if (spec != null && StringUtils.hasText(spec.templatePath())
                    && !Files.isRegularFile(Paths.get(spec.templatePath().trim()))) {
                throw new IllegalArgumentException("Template file not found: " + spec.templatePath());
            }
        }
        return questionnaires.stream()
                .map(spec -> spec == null ? new QuestionnaireSpec(null, null, null) : spec)
                .toList();
    }

    private String surveyName(QuestionnaireSpec spec, int index) {
        return StringUtils.hasText(spec.name()) ? spec.name().trim() : "survey_" + (index + 1);
    }

    private int copyCount(QuestionnaireSpec spec) {
        return spec.copyCount() == null || spec.copyCount() < 1 ? 1 : spec.copyCount();
    }

    private String extension(Path template) {
        String filename = template.getFileName().toString();
        int dot = filename.lastIndexOf('.');
        return dot <= 0 ? "" : filename.substring(dot);
    }
}
