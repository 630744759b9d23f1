package com.example.predictor.exception;

/** A single model failed mid-evaluation. Recovered locally with a neutral score. */
public class ScoringException extends PredictorException {

    public ScoringException(String message) {
        super(ErrorCode.SCORING_ERROR, message);
    }

    public ScoringException(String message, Throwable cause) {
        super(ErrorCode.SCORING_ERROR, message, cause);
    }
}
