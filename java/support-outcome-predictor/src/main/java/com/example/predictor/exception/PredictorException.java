package com.example.predictor.exception;

import java.util.Objects;

/**
 * Base runtime exception carrying a stable {@link ErrorCode}. Subclasses mark where in the
 * pipeline the failure originated and how it is handled.
 */
public class PredictorException extends RuntimeException {

    private final ErrorCode code;

    public PredictorException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public PredictorException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code=" + code.wireValue()
            + ", message=" + getMessage()
            + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
            + '}';
    }
}
