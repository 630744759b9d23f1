package com.example.predictor.exception;

/** The inference chain cannot produce a prediction at all; fails the request. */
public class PredictionUnavailableException extends PredictorException {

    public PredictionUnavailableException(String message, Throwable cause) {
        super(ErrorCode.PREDICTION_UNAVAILABLE, message, cause);
    }
}
