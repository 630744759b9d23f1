package com.example.predictor.exception;

/** Client-fixable request problem; surfaces as a 400. */
public class ValidationException extends PredictorException {

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }

    public ValidationException(ErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
