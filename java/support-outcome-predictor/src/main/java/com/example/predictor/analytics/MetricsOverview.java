package com.example.predictor.analytics;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.example.predictor.model.IssueType;
import com.example.predictor.model.MetricBucket;
import com.example.predictor.model.Priority;
import com.example.predictor.model.SatisfactionLevel;

/**
 * Totals across a snapshot, for the dashboard header. Averages are weighted by bucket count.
 */
public record MetricsOverview(
    long totalPredictions,
    long highPriority,
    long lowSatisfaction,
    long negativeSentiment,
    double avgConfidence,
    double avgLatencyMs,
    IssueType topIssueType,
    Map<SatisfactionLevel, Long> satisfactionDistribution,
    Map<Priority, Long> priorityDistribution,
    Map<IssueType, Long> issueTypeDistribution,
    Map<String, Long> sentimentDistribution,
    int bucketCount
) {

    public static final String NEGATIVE_SENTIMENT = "negative";

    public static MetricsOverview from(List<MetricBucket> buckets) {
        long total = 0;
        double confidenceSum = 0.0;
        double latencySum = 0.0;
        Map<SatisfactionLevel, Long> satisfaction = new EnumMap<>(SatisfactionLevel.class);
        Map<Priority, Long> priority = new EnumMap<>(Priority.class);
        Map<IssueType, Long> issueTypes = new EnumMap<>(IssueType.class);
        Map<String, Long> sentiment = new HashMap<>();

        for (MetricBucket b : buckets) {
            total += b.count();
            confidenceSum += b.avgConfidence() * b.count();
            latencySum += b.avgLatencyMs() * b.count();
            b.satisfactionHistogram().forEach((k, v) -> satisfaction.merge(k, v, Long::sum));
            b.priorityHistogram().forEach((k, v) -> priority.merge(k, v, Long::sum));
            b.issueTypeHistogram().forEach((k, v) -> issueTypes.merge(k, v, Long::sum));
            b.sentimentHistogram().forEach((k, v) -> sentiment.merge(k, v, Long::sum));
        }

        IssueType top = issueTypes.entrySet().stream()
            .max(Map.Entry.<IssueType, Long>comparingByValue()
                .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
            .map(Map.Entry::getKey)
            .orElse(null);

        return new MetricsOverview(
            total,
            priority.getOrDefault(Priority.HIGH, 0L),
            satisfaction.getOrDefault(SatisfactionLevel.LOW, 0L),
            sentiment.getOrDefault(NEGATIVE_SENTIMENT, 0L),
            total == 0 ? 0.0 : confidenceSum / total,
            total == 0 ? 0.0 : latencySum / total,
            top,
            Map.copyOf(satisfaction),
            Map.copyOf(priority),
            Map.copyOf(issueTypes),
            Map.copyOf(sentiment),
            buckets.size());
    }

    public double highPriorityRate() {
        return totalPredictions == 0 ? 0.0 : (double) highPriority / totalPredictions;
    }

    public double negativeSentimentRate() {
        return totalPredictions == 0 ? 0.0 : (double) negativeSentiment / totalPredictions;
    }
}
