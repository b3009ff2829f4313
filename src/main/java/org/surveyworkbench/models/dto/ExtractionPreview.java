package org.surveyworkbench.models.dto;

import java.util.Map;

public record ExtractionPreview(
        String participantId,
        Map<String, String> fields,
        boolean duplicate,
        CompletenessReport completeness
) {
}
