package com.example.predictor.telemetry;

import org.springframework.stereotype.Component;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

@Component
public class PredictorMetrics {

    private final LongCounter predictionCount;
    private final DoubleHistogram predictionLatency;
    private final DoubleHistogram predictionConfidence;
    private final LongCounter stageFallbackCount;
    private final LongCounter unavailableCount;
    private final LongCounter droppedEventCount;
    private final LongCounter insightGenerationCount;

    public PredictorMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter("support-outcome-predictor");

        this.predictionCount = meter.counterBuilder("predictor.prediction.count")
            .setDescription("Number of predictions served")
            .build();

        this.predictionLatency = meter.histogramBuilder("predictor.prediction.duration")
            .setUnit("ms")
            .setDescription("Wall-clock latency of /predict requests")
            .build();

        this.predictionConfidence = meter.histogramBuilder("predictor.prediction.confidence")
            .setDescription("Combined confidence of served predictions")
            .build();

        this.stageFallbackCount = meter.counterBuilder("predictor.stage.fallback.count")
            .setDescription("Scoring stages that fell back to a neutral score")
            .build();

        this.unavailableCount = meter.counterBuilder("predictor.prediction.unavailable.count")
            .setDescription("Requests failed because a required model was not loaded")
            .build();

        this.droppedEventCount = meter.counterBuilder("predictor.analytics.dropped.count")
            .setDescription("Prediction events that never reached the aggregator")
            .build();

        this.insightGenerationCount = meter.counterBuilder("predictor.insights.generation.count")
            .setDescription("Insight generation attempts by outcome")
            .build();
    }

    public void recordPrediction(String satisfaction, String priority, double confidence, long latencyMs) {
        Attributes attrs = Attributes.of(
            AttributeKey.stringKey("predictor.satisfaction"), satisfaction,
            AttributeKey.stringKey("predictor.priority"), priority
        );
        predictionCount.add(1, attrs);
        predictionLatency.record(latencyMs, attrs);
        predictionConfidence.record(confidence, attrs);
    }

    public void recordStageFallback(String capability, String errorCode) {
        stageFallbackCount.add(1, Attributes.of(
            AttributeKey.stringKey("predictor.capability"), capability,
            AttributeKey.stringKey("error.type"), errorCode
        ));
    }

    public void recordPredictionUnavailable(String capability) {
        unavailableCount.add(1, Attributes.of(
            AttributeKey.stringKey("predictor.capability"), capability
        ));
    }

    public void recordDroppedEvent(String reason) {
        droppedEventCount.add(1, Attributes.of(
            AttributeKey.stringKey("predictor.drop_reason"), reason
        ));
    }

    public void recordInsightGeneration(String outcome, String source) {
        insightGenerationCount.add(1, Attributes.of(
            AttributeKey.stringKey("predictor.insights.outcome"), outcome,
            AttributeKey.stringKey("predictor.insights.source"), source
        ));
    }
}
