package com.example.predictor.insights;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import com.example.predictor.MutableClock;
import com.example.predictor.analytics.BucketedAnalyticsAggregator;
import com.example.predictor.config.AnalyticsProperties;
import com.example.predictor.config.InsightsProperties;
import com.example.predictor.model.InsightReport;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.ModelScore;
import com.example.predictor.model.Prediction;
import com.example.predictor.model.PredictionEvent;
import com.example.predictor.model.Priority;
import com.example.predictor.model.SatisfactionLevel;
import com.example.predictor.model.Severity;
import com.example.predictor.telemetry.PredictorMetrics;

import static org.junit.jupiter.api.Assertions.*;

class InsightsGeneratorTest {

    private static final String GOOD_COMPLETION = """
        {"summary": "Half of the traffic is escalated.", "recommendations": ["Add login specialists"], "alerts": ["Escalation spike"]}
        """;

    private final MutableClock clock = new MutableClock(Instant.parse("2025-06-02T10:00:00Z"));
    private final BucketedAnalyticsAggregator aggregator =
        new BucketedAnalyticsAggregator(AnalyticsProperties.defaults(), clock);
    private final InsightsProperties properties =
        new InsightsProperties(false, null, Duration.ofMillis(200), 5, 0, 0);

    private InsightsGenerator generator(InsightBackend backend) {
        return new InsightsGenerator(backend, new InsightPromptBuilder(properties), aggregator,
            properties, new PredictorMetrics(), clock);
    }

    private void record(SatisfactionLevel satisfaction, Priority priority, String sentiment) {
        Prediction p = new Prediction("msg", IssueType.COMPLAINT, satisfaction, priority, 0.8, clock.instant());
        aggregator.record(new PredictionEvent(p, new ModelScore("complaint", 0.8), new ModelScore(sentiment, 0.8), 10));
    }

    @Test
    void startsWithRulesReportOverNoData() {
        InsightReport initial = generator((s, u) -> GOOD_COMPLETION).latest();

        assertEquals(InsightReport.SOURCE_RULES, initial.source());
        assertEquals(0, initial.dataPoints());
        assertEquals(Severity.LOW, initial.severity());
        assertFalse(initial.degraded());
    }

    @Test
    void successfulGenerationReplacesLatest() {
        record(SatisfactionLevel.LOW, Priority.HIGH, "negative");
        record(SatisfactionLevel.MEDIUM, Priority.MEDIUM, "neutral");
        var generator = generator((s, u) -> GOOD_COMPLETION);

        InsightReport report = generator.refresh();

        assertSame(report, generator.latest());
        assertEquals(InsightReport.SOURCE_LLM, report.source());
        assertEquals("Half of the traffic is escalated.", report.summaryText());
        assertEquals(List.of("Add login specialists"), report.recommendations());
        assertEquals(List.of("Escalation spike"), report.alerts());
        assertEquals(1, report.basedOnBucketCount());
        assertEquals(2, report.dataPoints());
        assertEquals(Severity.HIGH, report.severity());
        assertFalse(report.degraded());
    }

    @Test
    void backendTimeoutReturnsPreviousReportDegraded() {
        record(SatisfactionLevel.LOW, Priority.HIGH, "negative");
        var slow = new AtomicReference<Boolean>(false);
        var generator = generator((s, u) -> {
            if (slow.get()) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return GOOD_COMPLETION;
        });
        InsightReport previous = generator.refresh();
        clock.advance(Duration.ofMinutes(1));
        slow.set(true);

        InsightReport report = assertDoesNotThrow(() -> generator.generate(aggregator.snapshot(null)));

        assertTrue(report.degraded());
        assertEquals(previous.summaryText(), report.summaryText());
        assertEquals(previous.recommendations(), report.recommendations());
        assertEquals(previous.generatedAt(), report.generatedAt());
        assertEquals(report, generator.latest());
    }

    @Test
    void backendFailureBeforeAnySuccessFallsBackToRules() {
        record(SatisfactionLevel.LOW, Priority.HIGH, "negative");
        var generator = generator((s, u) -> {
            throw new IllegalStateException("connection refused");
        });

        InsightReport report = generator.refresh();

        assertTrue(report.degraded());
        assertEquals(InsightReport.SOURCE_RULES, report.source());
        assertEquals(1, report.dataPoints());
        assertEquals(Severity.HIGH, report.severity());
        assertFalse(report.alerts().isEmpty());
    }

    @Test
    void unparseableCompletionDegrades() {
        record(SatisfactionLevel.HIGH, Priority.LOW, "positive");
        var calls = new AtomicInteger();
        var generator = generator((s, u) -> calls.incrementAndGet() == 1 ? GOOD_COMPLETION : "Sorry, I can't help.");
        InsightReport first = generator.refresh();

        InsightReport second = generator.refresh();

        assertTrue(second.degraded());
        assertEquals(first.summaryText(), second.summaryText());
    }

    @Test
    void unchangedSnapshotGivesStructurallyEqualReports() {
        record(SatisfactionLevel.LOW, Priority.HIGH, "negative");
        record(SatisfactionLevel.HIGH, Priority.LOW, "positive");
        var generator = generator((s, u) -> GOOD_COMPLETION);
        var snapshot = aggregator.snapshot(null);

        assertEquals(generator.generate(snapshot), generator.generate(snapshot));
    }

    @Test
    void scheduledRefreshWaitsForEnoughNewPredictions() {
        var calls = new AtomicInteger();
        var generator = generator((s, u) -> {
            calls.incrementAndGet();
            return GOOD_COMPLETION;
        });

        assertFalse(generator.refreshIfDue());

        record(SatisfactionLevel.MEDIUM, Priority.MEDIUM, "neutral");
        assertTrue(generator.refreshIfDue());

        for (int i = 0; i < 4; i++) {
            record(SatisfactionLevel.MEDIUM, Priority.MEDIUM, "neutral");
        }
        assertFalse(generator.refreshIfDue());

        record(SatisfactionLevel.MEDIUM, Priority.MEDIUM, "neutral");
        assertTrue(generator.refreshIfDue());
        assertEquals(2, calls.get());
    }

    @Test
    void promptHandedToBackendRespectsBudget() {
        for (int i = 0; i < 50; i++) {
            record(SatisfactionLevel.LOW, Priority.HIGH, "negative");
            clock.advance(Duration.ofMinutes(1));
        }
        var prompt = new AtomicReference<String>();
        var generator = generator((s, u) -> {
            prompt.set(u);
            return GOOD_COMPLETION;
        });

        generator.refresh();

        assertNotNull(prompt.get());
        assertTrue(prompt.get().length() <= properties.maxPromptChars());
    }
}
