package org.surveyworkbench.models.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TemplateBundleEntry(
        int index,
        String name,
        @JsonProperty("template_path")
        String templatePath,
        @JsonProperty("copy_count")
        Integer copyCount
) {
    public QuestionnaireSpec toQuestionnaire() {
        return new QuestionnaireSpec(name, templatePath, copyCount);
    }
}
