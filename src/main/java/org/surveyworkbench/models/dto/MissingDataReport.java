package org.surveyworkbench.models.dto;

import java.util.List;

public record MissingDataReport(
        int completeCount,
        int incompleteCount,
        int total,
        List<CompletenessReport> participants
) {
}
