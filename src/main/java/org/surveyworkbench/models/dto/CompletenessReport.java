package org.surveyworkbench.models.dto;

import java.util.List;

public record CompletenessReport(
        String participantId,
        boolean complete,
        List<String> issues,
        List<String> files
) {
}
