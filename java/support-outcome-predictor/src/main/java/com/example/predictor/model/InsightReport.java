package com.example.predictor.model;

import java.time.Instant;
import java.util.List;

public record InsightReport(
    Instant generatedAt,
    String summaryText,
    List<String> recommendations,
    List<String> alerts,
    int basedOnBucketCount,
    long dataPoints,
    Severity severity,
    String source,
    boolean degraded
) {

    public static final String SOURCE_LLM = "llm";
    public static final String SOURCE_RULES = "rules";

    public InsightReport {
        recommendations = List.copyOf(recommendations);
        alerts = List.copyOf(alerts);
    }

    /** Same content flagged stale; the generation time is left untouched. */
    public InsightReport asDegraded() {
        if (degraded) return this;
        return new InsightReport(generatedAt, summaryText, recommendations, alerts,
            basedOnBucketCount, dataPoints, severity, source, true);
    }
}
