package com.example.predictor.exception;

public class AggregatorUnavailableException extends PredictorException {

    public AggregatorUnavailableException(String message, Throwable cause) {
        super(ErrorCode.AGGREGATOR_UNAVAILABLE, message, cause);
    }
}
