package com.example.predictor.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    LOW, MEDIUM, HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
