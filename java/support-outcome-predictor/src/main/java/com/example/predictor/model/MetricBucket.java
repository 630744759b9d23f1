package com.example.predictor.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Read-only copy of one aggregation window. Histogram maps are unmodifiable.
 */
public record MetricBucket(
    Instant windowStart,
    Duration windowWidth,
    long count,
    Map<SatisfactionLevel, Long> satisfactionHistogram,
    Map<Priority, Long> priorityHistogram,
    Map<IssueType, Long> issueTypeHistogram,
    Map<String, Long> sentimentHistogram,
    double avgConfidence,
    double avgLatencyMs
) {}
