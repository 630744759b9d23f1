package com.example.predictor.insights;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.example.predictor.analytics.MetricsOverview;
import com.example.predictor.model.InsightReport;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.MetricBucket;
import com.example.predictor.model.Priority;
import com.example.predictor.model.SatisfactionLevel;
import com.example.predictor.model.Severity;

import static org.junit.jupiter.api.Assertions.*;

class FallbackInsightsTest {

    private static final Instant NOW = Instant.parse("2025-06-02T10:00:00Z");

    private static MetricsOverview overview(long total, long highPriority, long negative) {
        return MetricsOverview.from(List.of(new MetricBucket(NOW, Duration.ofMinutes(1), total,
            Map.of(SatisfactionLevel.MEDIUM, total),
            Map.of(Priority.HIGH, highPriority),
            Map.of(IssueType.GENERAL, total),
            Map.of("negative", negative),
            0.8, 10.0)));
    }

    @ParameterizedTest
    @CsvSource({
        "100, 41,  0, HIGH",
        "100,  0, 51, HIGH",
        "100, 40, 50, MEDIUM",
        "100, 21,  0, MEDIUM",
        "100,  0, 31, MEDIUM",
        "100, 20, 30, LOW",
        "  0,  0,  0, LOW",
    })
    void severityFollowsRateThresholds(long total, long highPriority, long negative, Severity expected) {
        assertEquals(expected, FallbackInsights.severity(overview(total, highPriority, negative)));
    }

    @Test
    void alertsFireAboveThirtyAndFortyPercent() {
        assertEquals(2, FallbackInsights.alerts(overview(10, 4, 5)).size());
        assertEquals(List.of(), FallbackInsights.alerts(overview(10, 3, 4)));
    }

    @Test
    void reportSummarizesData() {
        InsightReport report = FallbackInsights.report(overview(10, 3, 2), NOW, false);

        assertEquals(InsightReport.SOURCE_RULES, report.source());
        assertEquals(10, report.dataPoints());
        assertEquals(Severity.MEDIUM, report.severity());
        assertTrue(report.summaryText().contains("Analyzed 10 predictions"));
        assertTrue(report.recommendations().contains("Review high priority case resolution processes"));
    }

    @Test
    void emptyDataReport() {
        InsightReport report = FallbackInsights.report(MetricsOverview.from(List.of()), NOW, false);

        assertEquals(0, report.dataPoints());
        assertEquals(Severity.LOW, report.severity());
        assertTrue(report.alerts().isEmpty());
    }
}
