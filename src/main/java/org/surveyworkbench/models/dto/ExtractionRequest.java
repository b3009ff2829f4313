package org.surveyworkbench.models.dto;

public record ExtractionRequest(
        String participantId,
        String sourcePath,
        String masterfilePath,
        Integer expectedSurveyCount,
        boolean force
) {
}
