package com.example.predictor.analytics;

import java.time.Instant;

import com.example.predictor.model.IssueType;
import com.example.predictor.model.ModelScore;
import com.example.predictor.model.Prediction;
import com.example.predictor.model.PredictionEvent;
import com.example.predictor.model.Priority;
import com.example.predictor.model.SatisfactionLevel;

final class AnalyticsFixtures {

    private AnalyticsFixtures() {}

    static PredictionEvent event(SatisfactionLevel satisfaction, Priority priority, IssueType issueType,
                                 String sentiment, double confidence, long latencyMs) {
        Prediction prediction = new Prediction("message", issueType, satisfaction, priority,
            confidence, Instant.parse("2025-06-02T10:00:00Z"));
        return new PredictionEvent(prediction, new ModelScore("general_inquiry", 0.9),
            new ModelScore(sentiment, confidence), latencyMs);
    }

    static PredictionEvent event(double confidence, long latencyMs) {
        return event(SatisfactionLevel.MEDIUM, Priority.MEDIUM, IssueType.GENERAL, "neutral", confidence, latencyMs);
    }
}
