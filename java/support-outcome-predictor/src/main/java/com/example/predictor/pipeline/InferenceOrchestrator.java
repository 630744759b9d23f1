package com.example.predictor.pipeline;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.predictor.config.PredictionProperties;
import com.example.predictor.exception.ModelUnavailableException;
import com.example.predictor.exception.PredictionUnavailableException;
import com.example.predictor.exception.ScoringException;
import com.example.predictor.model.Capability;
import com.example.predictor.model.ModelScore;
import com.example.predictor.model.Prediction;
import com.example.predictor.model.PredictionRequest;
import com.example.predictor.model.Priority;
import com.example.predictor.model.SatisfactionLevel;
import com.example.predictor.registry.ModelRegistry;
import com.example.predictor.registry.ScoringUnit;
import com.example.predictor.telemetry.PredictorMetrics;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Runs intent scoring, then sentiment scoring, then the priority heuristic, and folds the
 * results into one {@link Prediction}. Blocking; callers on an event loop must offload it.
 */
@Component
public class InferenceOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(InferenceOrchestrator.class);

    private final ModelRegistry registry;
    private final DecisionPolicy policy;
    private final PredictionProperties properties;
    private final PredictorMetrics metrics;
    private final Clock clock;
    private final Tracer tracer;

    public InferenceOrchestrator(
        ModelRegistry registry,
        DecisionPolicy policy,
        PredictionProperties properties,
        PredictorMetrics metrics,
        Clock clock
    ) {
        this.registry = registry;
        this.policy = policy;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.tracer = GlobalOpenTelemetry.getTracer("support-outcome-predictor");
    }

    public Prediction infer(PredictionRequest request) {
        return evaluate(request).prediction();
    }

    public InferenceTrace evaluate(PredictionRequest request) {
        Span span = tracer.spanBuilder("predict_outcome")
            .setAttribute("predictor.issue_type", request.issueType().wireName())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            // Resolve every stage up front so a missing model fails before any scoring runs
            ScoringUnit intentUnit = resolve(Capability.INTENT);
            ScoringUnit sentimentUnit = resolve(Capability.SENTIMENT);

            ModelScore intent = score(intentUnit, request);
            ModelScore sentiment = score(sentimentUnit, request);

            SatisfactionLevel satisfaction = policy.satisfaction(sentiment);
            Priority priority = policy.priority(request.issueType(), satisfaction);
            double confidence = Math.min(intent.confidence(), sentiment.confidence());

            span.setAttribute("predictor.intent", intent.label());
            span.setAttribute("predictor.sentiment", sentiment.label());
            span.setAttribute("predictor.satisfaction", satisfaction.wireName());
            span.setAttribute("predictor.priority", priority.wireName());
            span.setAttribute("predictor.confidence", confidence);

            Prediction prediction = new Prediction(
                request.message(), request.issueType(), satisfaction, priority,
                confidence, Instant.now(clock));

            log.debug("Prediction: issue_type={} intent={} sentiment={} -> satisfaction={} priority={} confidence={}",
                request.issueType().wireName(), intent.label(), sentiment.label(),
                satisfaction.wireName(), priority.wireName(), confidence);
            return new InferenceTrace(prediction, intent, sentiment);

        } catch (PredictionUnavailableException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }

    private ScoringUnit resolve(Capability capability) {
        String version = properties.pinnedVersion(capability).orElse(null);
        try {
            return registry.resolve(capability, version);
        } catch (ModelUnavailableException e) {
            throw unavailable(capability, e);
        }
    }

    private PredictionUnavailableException unavailable(Capability capability, ModelUnavailableException e) {
        metrics.recordPredictionUnavailable(capability.wireName());
        log.error("Cannot predict: {}", e.getMessage());
        return new PredictionUnavailableException("Prediction unavailable: " + e.getMessage(), e);
    }

    private ModelScore score(ScoringUnit unit, PredictionRequest request) {
        String stage = unit.capability().wireName();
        Span span = tracer.spanBuilder("score_" + stage)
            .setAttribute("predictor.stage", stage)
            .setAttribute("predictor.model_version", unit.version())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            ModelScore score = unit.score(request.message(), request.issueType());
            span.setAttribute("predictor.label", score.label());
            span.setAttribute("predictor.confidence", score.confidence());
            return score;

        } catch (ScoringException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            metrics.recordStageFallback(stage, e.getCode().wireValue());
            log.warn("{} stage fell back to neutral score: {}", stage, e.getMessage());
            return ModelScore.unknown();

        } catch (ModelUnavailableException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw unavailable(unit.capability(), e);

        } finally {
            span.end();
        }
    }
}
