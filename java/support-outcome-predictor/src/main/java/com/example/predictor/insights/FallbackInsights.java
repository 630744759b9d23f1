package com.example.predictor.insights;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.example.predictor.analytics.MetricsOverview;
import com.example.predictor.model.InsightReport;
import com.example.predictor.model.Severity;

/**
 * Rule-based insights computed straight from the totals. Serves the report shown before the
 * first generation and the one used when the backend has never answered.
 */
final class FallbackInsights {

    static final double HIGH_PRIORITY_ALERT_RATE = 0.30;
    static final double NEGATIVE_ALERT_RATE = 0.40;

    private FallbackInsights() {}

    static Severity severity(MetricsOverview overview) {
        if (overview.totalPredictions() == 0) {
            return Severity.LOW;
        }
        double highPriority = overview.highPriorityRate();
        double negative = overview.negativeSentimentRate();
        if (highPriority > 0.40 || negative > 0.50) {
            return Severity.HIGH;
        }
        if (highPriority > 0.20 || negative > 0.30) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    static List<String> alerts(MetricsOverview overview) {
        List<String> alerts = new ArrayList<>();
        if (overview.highPriorityRate() > HIGH_PRIORITY_ALERT_RATE) {
            alerts.add(String.format(Locale.ROOT,
                "High priority spike: %.1f%% of cases need urgent attention", overview.highPriorityRate() * 100));
        }
        if (overview.negativeSentimentRate() > NEGATIVE_ALERT_RATE) {
            alerts.add(String.format(Locale.ROOT,
                "Customer satisfaction concern: %.1f%% negative sentiment detected", overview.negativeSentimentRate() * 100));
        }
        return alerts;
    }

    static InsightReport report(MetricsOverview overview, Instant generatedAt, boolean degraded) {
        long total = overview.totalPredictions();
        if (total == 0) {
            return new InsightReport(generatedAt,
                "No predictions recorded yet. Insights appear once support messages are being scored.",
                List.of("Route incoming support traffic through /predict to start collecting data"),
                List.of(), overview.bucketCount(), 0, Severity.LOW, InsightReport.SOURCE_RULES, degraded);
        }

        double highPriority = overview.highPriorityRate() * 100;
        double negative = overview.negativeSentimentRate() * 100;
        String summary = String.format(Locale.ROOT,
            "Analyzed %d predictions: %.1f%% high priority, %.1f%% negative sentiment, average confidence %.2f.",
            total, highPriority, negative, overview.avgConfidence());
        if (overview.topIssueType() != null) {
            summary += " Most frequent issue type: " + overview.topIssueType().wireName() + ".";
        }

        List<String> recommendations = new ArrayList<>();
        recommendations.add("Continue monitoring customer satisfaction trends");
        recommendations.add(highPriority > 20
            ? "Review high priority case resolution processes"
            : "Maintain current service levels");

        return new InsightReport(generatedAt, summary, recommendations, alerts(overview),
            overview.bucketCount(), total, severity(overview), InsightReport.SOURCE_RULES, degraded);
    }
}
