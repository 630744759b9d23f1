package com.example.predictor.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import com.example.predictor.exception.ErrorCode;
import com.example.predictor.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueType {
    GENERAL("general"),
    ACCOUNT_ACCESS("account_access"),
    BILLING("billing"),
    SHIPPING("shipping"),
    TECHNICAL_SUPPORT("technical_support"),
    COMPLAINT("complaint"),
    COMPLIMENT("compliment");

    private final String wireName;

    IssueType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Strict parse: unknown values are rejected, never mapped to {@link #GENERAL}. */
    public static IssueType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ErrorCode.MISSING_ISSUE_TYPE, "issue_type is required");
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (IssueType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new ValidationException(ErrorCode.INVALID_ISSUE_TYPE,
            "Unknown issue_type '" + value + "'. Allowed: " + allowedValues());
    }

    public static String allowedValues() {
        return Arrays.stream(values()).map(IssueType::wireName).collect(Collectors.joining(", "));
    }
}
