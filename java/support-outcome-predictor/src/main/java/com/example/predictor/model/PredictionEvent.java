package com.example.predictor.model;

/**
 * What the gateway hands to analytics for one served request. The per-stage scores ride
 * along so the aggregator can keep a sentiment distribution.
 */
public record PredictionEvent(
    Prediction prediction,
    ModelScore intent,
    ModelScore sentiment,
    long latencyMs
) {}
