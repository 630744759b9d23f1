package com.example.predictor.controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.example.predictor.analytics.PredictionEventPublisher;
import com.example.predictor.config.PredictionProperties;
import com.example.predictor.exception.ErrorCode;
import com.example.predictor.exception.ValidationException;
import com.example.predictor.filter.MessageRedactor;
import com.example.predictor.model.Capability;
import com.example.predictor.model.Prediction;
import com.example.predictor.model.PredictionEvent;
import com.example.predictor.model.PredictionRequest;
import com.example.predictor.pipeline.InferenceOrchestrator;
import com.example.predictor.pipeline.InferenceTrace;
import com.example.predictor.registry.ModelRegistry;
import com.example.predictor.telemetry.PredictorMetrics;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class PredictionController {

    private static final Logger log = LoggerFactory.getLogger(PredictionController.class);

    private final InferenceOrchestrator orchestrator;
    private final PredictionEventPublisher publisher;
    private final ModelRegistry registry;
    private final PredictionProperties properties;
    private final MessageRedactor redactor;
    private final PredictorMetrics metrics;

    public PredictionController(
        InferenceOrchestrator orchestrator,
        PredictionEventPublisher publisher,
        ModelRegistry registry,
        PredictionProperties properties,
        MessageRedactor redactor,
        PredictorMetrics metrics
    ) {
        this.orchestrator = orchestrator;
        this.publisher = publisher;
        this.registry = registry;
        this.properties = properties;
        this.redactor = redactor;
        this.metrics = metrics;
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PredictionRequestBody(String message, String issueType) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PredictionResponse(
        String message,
        String issueType,
        String predictedSatisfaction,
        String recommendedPriority,
        double confidence,
        String timestamp
    ) {
        static PredictionResponse from(Prediction p) {
            return new PredictionResponse(
                p.message(),
                p.issueType().wireName(),
                p.predictedSatisfaction().wireName(),
                p.recommendedPriority().wireName(),
                p.confidence(),
                p.timestamp().toString());
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record HealthResponse(
        String status,
        List<String> missingCapabilities,
        Map<String, List<String>> models
    ) {}

    @PostMapping("/predict")
    public Mono<PredictionResponse> predict(@RequestBody PredictionRequestBody body) {
        if (body == null) {
            return Mono.error(new ValidationException(ErrorCode.MALFORMED_JSON, "Request body is required"));
        }
        PredictionRequest request;
        try {
            request = PredictionRequest.of(body.message(), body.issueType(), properties.maxMessageLength());
        } catch (ValidationException e) {
            log.info("Rejected /predict: {} ({})", e.getCode().wireValue(), e.getMessage());
            return Mono.error(e);
        }

        long startNanos = System.nanoTime();
        return Mono.fromCallable(() -> orchestrator.evaluate(request))
            .subscribeOn(Schedulers.boundedElastic())
            .map(trace -> complete(trace, startNanos));
    }

    private PredictionResponse complete(InferenceTrace trace, long startNanos) {
        Prediction prediction = trace.prediction();
        long latencyMs = (System.nanoTime() - startNanos) / 1_000_000;

        publisher.publish(new PredictionEvent(prediction, trace.intent(), trace.sentiment(), latencyMs));
        metrics.recordPrediction(prediction.predictedSatisfaction().wireName(),
            prediction.recommendedPriority().wireName(), prediction.confidence(), latencyMs);

        log.info("Predicted: issue_type={} satisfaction={} priority={} confidence={} latency={}ms message=\"{}\"",
            prediction.issueType().wireName(), prediction.predictedSatisfaction().wireName(),
            prediction.recommendedPriority().wireName(), String.format("%.3f", prediction.confidence()),
            latencyMs, redactor.preview(prediction.message(), 80));
        return PredictionResponse.from(prediction);
    }

    @GetMapping("/health")
    public Mono<HealthResponse> health() {
        List<String> missing = registry.missingCapabilities().stream()
            .map(Capability::wireName)
            .sorted()
            .toList();
        Map<String, List<String>> models = new LinkedHashMap<>();
        registry.loadedVersions().forEach((capability, versions) -> models.put(capability.wireName(), versions));

        return Mono.just(new HealthResponse(missing.isEmpty() ? "ok" : "degraded", missing, models));
    }
}
