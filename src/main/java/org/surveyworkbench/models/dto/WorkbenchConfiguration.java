package org.surveyworkbench.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkbenchConfiguration(
        String name,
        String targetPath,
        List<QuestionnaireSpec> questionnaires,
        String sourcePath,
        String masterfilePath
) {
}
