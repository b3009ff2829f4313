package org.surveyworkbench.models.dto;

import java.util.List;

public record BatchResult(
        int total,
        List<String> succeeded,
        List<String> duplicates,
        List<String> incomplete,
        List<String> failed,
        String masterfilePath
) {
}
