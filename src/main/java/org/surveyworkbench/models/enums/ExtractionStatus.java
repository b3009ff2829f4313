package org.surveyworkbench.models.enums;

public enum ExtractionStatus {
    EXTRACTED,
    DUPLICATE,
    INCOMPLETE
}
