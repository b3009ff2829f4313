package org.surveyworkbench.models.dto;

import org.surveyworkbench.models.enums.ExtractionStatus;

public record ExtractionOutcome(
        String participantId,
        ExtractionStatus status, // Enum: EXTRACTED, DUPLICATE, INCOMPLETE
        int fieldCount,
        String masterfilePath,
        CompletenessReport completeness
) {
}
