package com.example.predictor.insights;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.example.predictor.analytics.MetricsOverview;
import com.example.predictor.config.InsightsProperties;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.MetricBucket;
import com.example.predictor.model.Priority;
import com.example.predictor.model.SatisfactionLevel;

/**
 * Renders a metrics snapshot into the user prompt for the insight model. Output never exceeds
 * the configured character budget: only the most recent buckets are listed, and the bucket
 * table is cut before the totals are.
 */
@Component
public class InsightPromptBuilder {

    static final String SYSTEM_PROMPT = """
        You are an expert customer service analyst. You receive aggregated metrics from a
        support-outcome prediction service and write a short business summary for the support lead.

        Respond ONLY with a JSON object (no markdown, no explanation):
        {
          "summary": "2-3 sentence overview of the current situation with concrete numbers",
          "recommendations": ["specific actionable recommendation", "..."],
          "alerts": ["critical issue needing immediate attention, or empty"]
        }

        Focus on escalation load, customer satisfaction and which issue types drive them.
        """;

    private static final String TRUNCATED = "... (older buckets omitted)\n";

    private final int maxBuckets;
    private final int maxChars;

    public InsightPromptBuilder(InsightsProperties properties) {
        this.maxBuckets = properties.maxPromptBuckets();
        this.maxChars = properties.maxPromptChars();
    }

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String build(List<MetricBucket> snapshot, MetricsOverview overview) {
        StringBuilder head = new StringBuilder();
        head.append("OVERALL METRICS\n");
        head.append("- Total predictions: ").append(overview.totalPredictions()).append('\n');
        head.append("- High priority: ").append(overview.highPriority())
            .append(" (").append(percent(overview.highPriorityRate())).append(")\n");
        head.append("- Low satisfaction: ").append(overview.lowSatisfaction()).append('\n');
        head.append("- Negative sentiment: ").append(overview.negativeSentiment())
            .append(" (").append(percent(overview.negativeSentimentRate())).append(")\n");
        head.append("- Average confidence: ").append(fmt(overview.avgConfidence())).append('\n');
        head.append("- Average latency: ").append(fmt(overview.avgLatencyMs())).append("ms\n");
        head.append("- Top issue type: ")
            .append(overview.topIssueType() != null ? overview.topIssueType().wireName() : "none").append('\n');
        head.append("\nISSUE TYPES\n").append(distribution(overview.issueTypeDistribution()));
        head.append("\nSENTIMENT\n").append(distribution(overview.sentimentDistribution()));

        String header = cut(head.toString(), maxChars);
        int remaining = maxChars - header.length();

        List<MetricBucket> recent = snapshot.size() > maxBuckets
            ? snapshot.subList(snapshot.size() - maxBuckets, snapshot.size())
            : snapshot;

        String tableTitle = "\nRECENT WINDOWS (start, count, low/medium/high satisfaction, high priority, avg confidence)\n";
        if (recent.isEmpty() || remaining < tableTitle.length() + TRUNCATED.length()) {
            return header;
        }

        StringBuilder table = new StringBuilder(tableTitle);
        boolean omitted = snapshot.size() > recent.size();
        // newest first so truncation drops the oldest rows
        for (int i = recent.size() - 1; i >= 0; i--) {
            String row = row(recent.get(i));
            if (table.length() + row.length() + TRUNCATED.length() > remaining) {
                omitted = true;
                break;
            }
            table.append(row);
        }
        if (omitted) {
            table.append(TRUNCATED);
        }
        return header + table;
    }

    private static String row(MetricBucket b) {
        return String.format(Locale.ROOT, "- %s, %d, %d/%d/%d, %d, %.2f\n",
            b.windowStart(), b.count(),
            b.satisfactionHistogram().getOrDefault(SatisfactionLevel.LOW, 0L),
            b.satisfactionHistogram().getOrDefault(SatisfactionLevel.MEDIUM, 0L),
            b.satisfactionHistogram().getOrDefault(SatisfactionLevel.HIGH, 0L),
            b.priorityHistogram().getOrDefault(Priority.HIGH, 0L),
            b.avgConfidence());
    }

    private static String distribution(Map<?, Long> counts) {
        if (counts.isEmpty()) {
            return "- no data\n";
        }
        return counts.entrySet().stream()
            .map(e -> Map.entry(label(e.getKey()), e.getValue()))
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, Long>comparingByKey()))
            .map(e -> "- " + e.getKey() + ": " + e.getValue() + "\n")
            .collect(Collectors.joining());
    }

    private static String label(Object key) {
        if (key instanceof IssueType type) {
            return type.wireName();
        }
        return String.valueOf(key);
    }

    private static String cut(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }

    private static String percent(double rate) {
        return String.format(Locale.ROOT, "%.1f%%", rate * 100);
    }

    private static String fmt(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
