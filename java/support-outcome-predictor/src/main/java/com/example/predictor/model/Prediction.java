package com.example.predictor.model;

import java.time.Instant;

public record Prediction(
    String message,
    IssueType issueType,
    SatisfactionLevel predictedSatisfaction,
    Priority recommendedPriority,
    double confidence,
    Instant timestamp
) {}
