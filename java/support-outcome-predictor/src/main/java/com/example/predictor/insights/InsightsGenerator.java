package com.example.predictor.insights;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.predictor.analytics.AnalyticsAggregator;
import com.example.predictor.analytics.MetricsOverview;
import com.example.predictor.config.InsightsProperties;
import com.example.predictor.insights.InsightResponseParser.ParsedInsight;
import com.example.predictor.model.InsightReport;
import com.example.predictor.model.MetricBucket;
import com.example.predictor.telemetry.PredictorMetrics;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Owns the single latest-report cell. Readers always get a complete report; a failed or timed
 * out generation leaves the previous content in place, flagged degraded.
 */
@Component
public class InsightsGenerator {

    private static final Logger log = LoggerFactory.getLogger(InsightsGenerator.class);

    private final InsightBackend backend;
    private final InsightPromptBuilder promptBuilder;
    private final AnalyticsAggregator aggregator;
    private final InsightsProperties properties;
    private final PredictorMetrics metrics;
    private final Clock clock;
    private final Tracer tracer;

    private final AtomicReference<InsightReport> latest = new AtomicReference<>();
    private final AtomicBoolean generatedOnce = new AtomicBoolean();
    private final AtomicLong recordedAtLastGeneration = new AtomicLong();
    private final ReentrantLock generationLock = new ReentrantLock();

    public InsightsGenerator(
        InsightBackend backend,
        InsightPromptBuilder promptBuilder,
        AnalyticsAggregator aggregator,
        InsightsProperties properties,
        PredictorMetrics metrics,
        Clock clock
    ) {
        this.backend = backend;
        this.promptBuilder = promptBuilder;
        this.aggregator = aggregator;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.tracer = GlobalOpenTelemetry.getTracer("support-outcome-predictor");
        this.latest.set(FallbackInsights.report(MetricsOverview.from(List.of()), Instant.now(clock), false));
    }

    public InsightReport latest() {
        return latest.get();
    }

    /** Explicit trigger: regenerates from the current snapshot regardless of new traffic. */
    public InsightReport refresh() {
        return generate(aggregator.snapshot(null));
    }

    /**
     * Scheduled trigger. Regenerates only when nothing has been generated yet or enough new
     * predictions arrived since the last attempt.
     */
    public boolean refreshIfDue() {
        long recorded = aggregator.totalRecorded();
        long fresh = recorded - recordedAtLastGeneration.get();
        if (fresh < 0) {
            // aggregator was reset
            recordedAtLastGeneration.set(0);
            fresh = recorded;
        }
        if (generatedOnce.get() && fresh < properties.minNewPredictions()) {
            return false;
        }
        if (recorded == 0) {
            return false;
        }
        refresh();
        return true;
    }

    public InsightReport generate(List<MetricBucket> snapshot) {
        generationLock.lock();
        Span span = tracer.spanBuilder("generate_insights")
            .setAttribute("predictor.insights.buckets", (long) snapshot.size())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            MetricsOverview overview = MetricsOverview.from(snapshot);
            recordedAtLastGeneration.set(aggregator.totalRecorded());
            InsightReport report;
            try {
                report = callBackend(snapshot, overview);
                generatedOnce.set(true);
                metrics.recordInsightGeneration("success", report.source());
                log.info("Insights generated: buckets={} data_points={} severity={}",
                    report.basedOnBucketCount(), report.dataPoints(), report.severity().wireName());
            } catch (RuntimeException e) {
                span.setStatus(StatusCode.ERROR, e.getMessage());
                report = degrade(overview);
                metrics.recordInsightGeneration("degraded", report.source());
                log.warn("Insight generation failed, serving degraded report: {}", describe(e));
            }
            span.setAttribute("predictor.insights.degraded", report.degraded());
            latest.set(report);
            return report;

        } finally {
            span.end();
            generationLock.unlock();
        }
    }

    private InsightReport callBackend(List<MetricBucket> snapshot, MetricsOverview overview) {
        String userPrompt = promptBuilder.build(snapshot, overview);
        String completion = Mono.fromCallable(() -> backend.complete(promptBuilder.systemPrompt(), userPrompt))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(properties.timeout())
            .block();

        ParsedInsight parsed = InsightResponseParser.parse(completion);
        return new InsightReport(
            Instant.now(clock),
            parsed.summary(),
            parsed.recommendations(),
            parsed.alerts(),
            snapshot.size(),
            overview.totalPredictions(),
            FallbackInsights.severity(overview),
            InsightReport.SOURCE_LLM,
            false);
    }

    private InsightReport degrade(MetricsOverview overview) {
        if (!generatedOnce.get()) {
            // nothing generated yet, so the rules report over current data beats the empty placeholder
            return FallbackInsights.report(overview, Instant.now(clock), true);
        }
        return latest.get().asDegraded();
    }

    private static String describe(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getMessage() == null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException
            || cause.getCause() instanceof TimeoutException) {
            return "timed out";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
