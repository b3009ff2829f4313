package org.surveyworkbench.models.dto;

import jakarta.validation.constraints.NotBlank;

public record BatchExtractionRequest(
        @NotBlank(message = "Please enter at least one participant ID!")
        String participantIds, // comma or newline separated
        String sourcePath,
        String masterfilePath,
        Integer expectedSurveyCount
) {
}
