package com.example.predictor.exception;

public class InsightsBackendException extends PredictorException {

    public InsightsBackendException(String message) {
        super(ErrorCode.INSIGHTS_BACKEND_ERROR, message);
    }

    public InsightsBackendException(String message, Throwable cause) {
        super(ErrorCode.INSIGHTS_BACKEND_ERROR, message, cause);
    }
}
