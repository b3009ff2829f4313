package org.surveyworkbench.models.dto;

import jakarta.validation.constraints.NotBlank;

public record CompletenessRequest(
        @NotBlank(message = "Please enter a participant ID!")
        String participantId,
        @NotBlank(message = "Please select a source folder!")
        String sourcePath,
        Integer expectedSurveyCount
) {
}
