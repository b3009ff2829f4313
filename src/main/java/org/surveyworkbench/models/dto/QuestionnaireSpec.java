package org.surveyworkbench.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QuestionnaireSpec(
        String name,
        String templatePath,
        Integer copyCount
) {
}
