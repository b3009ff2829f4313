package org.surveyworkbench.models.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record BatchGenerateRequest(
        @NotBlank(message = "Please enter at least one participant ID!")
        String participantIds, // comma or newline separated
        String targetPath,
        List<QuestionnaireSpec> questionnaires
) {
}
