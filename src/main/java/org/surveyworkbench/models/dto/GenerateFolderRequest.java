package org.surveyworkbench.models.dto;

import java.util.List;

public record GenerateFolderRequest(
        String participantId,
        String targetPath,
        List<QuestionnaireSpec> questionnaires
) {
}
