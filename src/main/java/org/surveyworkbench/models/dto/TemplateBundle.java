package org.surveyworkbench.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TemplateBundle(
        String name,
        @JsonProperty("questionnaire_count")
        int questionnaireCount,
        List<TemplateBundleEntry> questionnaires
) {
}
