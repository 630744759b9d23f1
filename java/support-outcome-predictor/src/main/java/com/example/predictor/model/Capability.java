package com.example.predictor.model;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Capability {
    INTENT("intent"),
    SENTIMENT("sentiment");

    private final String wireName;

    Capability(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static Optional<Capability> fromWire(String value) {
        if (value == null) return Optional.empty();
        String normalized = value.strip().toLowerCase().replace('-', '_');
        return Arrays.stream(values())
            .filter(c -> c.wireName.equals(normalized))
            .findFirst();
    }
}
