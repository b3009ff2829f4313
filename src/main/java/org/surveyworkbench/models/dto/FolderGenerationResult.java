package org.surveyworkbench.models.dto;

import java.util.List;

public record FolderGenerationResult(
        String participantId,
        String folder,
        List<String> files
) {
}
