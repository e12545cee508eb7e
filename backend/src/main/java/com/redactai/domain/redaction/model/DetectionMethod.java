package com.redactai.domain.redaction.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionMethod {
    PATTERN("pattern"),
    CONTEXTUAL("contextual"),
    UNSTRUCTURED("unstructured"),
    RETROSPECTIVE("retrospective"),
    SEMANTIC("semantic");

    private final String value;

    DetectionMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
