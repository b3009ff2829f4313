package org.surveyworkbench.models.dto;

import jakarta.validation.constraints.NotBlank;

public record DuplicateCheckRequest(
        @NotBlank(message = "Please enter a participant ID!")
        String participantId,
        @NotBlank(message = "Please select a masterfile!")
        String masterfilePath
) {
}
