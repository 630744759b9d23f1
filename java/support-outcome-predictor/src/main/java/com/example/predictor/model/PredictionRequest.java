package com.example.predictor.model;

import com.example.predictor.exception.ErrorCode;
import com.example.predictor.exception.ValidationException;

public record PredictionRequest(String message, IssueType issueType) {

    public PredictionRequest {
        if (message == null || message.isBlank()) {
            throw new ValidationException(ErrorCode.EMPTY_MESSAGE, "message must not be empty");
        }
        if (issueType == null) {
            throw new ValidationException(ErrorCode.MISSING_ISSUE_TYPE, "issue_type is required");
        }
        message = message.strip();
    }

    public static PredictionRequest of(String message, String issueType, int maxMessageLength) {
        PredictionRequest request = new PredictionRequest(message, IssueType.fromWire(issueType));
        if (request.message().length() > maxMessageLength) {
            throw new ValidationException(ErrorCode.MESSAGE_TOO_LONG,
                "message exceeds " + maxMessageLength + " characters");
        }
        return request;
    }
}
