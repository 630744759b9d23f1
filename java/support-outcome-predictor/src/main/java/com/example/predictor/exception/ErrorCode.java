package com.example.predictor.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable, machine-readable error codes returned in {@code error_code} of every error body.
 */
public enum ErrorCode {
    MALFORMED_JSON("malformed_json"),
    EMPTY_MESSAGE("empty_message"),
    MESSAGE_TOO_LONG("message_too_long"),
    MISSING_ISSUE_TYPE("missing_issue_type"),
    INVALID_ISSUE_TYPE("invalid_issue_type"),
    MODEL_UNAVAILABLE("model_unavailable"),
    SCORING_ERROR("scoring_error"),
    PREDICTION_UNAVAILABLE("prediction_unavailable"),
    AGGREGATOR_UNAVAILABLE("aggregator_unavailable"),
    INSIGHTS_BACKEND_ERROR("insights_backend_error"),
    UPSTREAM_UNAVAILABLE("upstream_unavailable"),
    INVALID_PARAMETER("invalid_parameter"),
    UNSUPPORTED_MEDIA_TYPE("unsupported_media_type"),
    METHOD_NOT_ALLOWED("method_not_allowed"),
    NOT_FOUND("not_found"),
    INVALID_REQUEST("invalid_request"),
    INTERNAL_ERROR("internal_error");

    private final String wireValue;

    ErrorCode(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
