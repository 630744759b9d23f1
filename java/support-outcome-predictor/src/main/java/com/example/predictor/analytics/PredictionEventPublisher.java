package com.example.predictor.analytics;

import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.example.predictor.exception.AggregatorUnavailableException;
import com.example.predictor.model.PredictionEvent;
import com.example.predictor.telemetry.PredictorMetrics;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Hands prediction events to the aggregator off the request thread. Delivery is best effort:
 * when the analytics scheduler is saturated or the aggregator throws, the event is logged
 * and dropped. {@link #publish} never blocks and never throws.
 */
@Component
public class PredictionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(PredictionEventPublisher.class);

    private final AnalyticsAggregator aggregator;
    private final PredictionEventLog eventLog;
    private final Scheduler scheduler;
    private final PredictorMetrics metrics;

    public PredictionEventPublisher(
        AnalyticsAggregator aggregator,
        PredictionEventLog eventLog,
        @Qualifier("analyticsScheduler") Scheduler scheduler,
        PredictorMetrics metrics
    ) {
        this.aggregator = aggregator;
        this.eventLog = eventLog;
        this.scheduler = scheduler;
        this.metrics = metrics;
    }

    public void publish(PredictionEvent event) {
        try {
            Mono.fromRunnable(() -> deliver(event))
                .subscribeOn(scheduler)
                .subscribe(null, this::drop);
        } catch (RejectedExecutionException e) {
            drop(e);
        }
    }

    void deliver(PredictionEvent event) {
        try {
            aggregator.record(event);
        } catch (RuntimeException e) {
            throw new AggregatorUnavailableException("Aggregator rejected event: " + e.getMessage(), e);
        }
        if (eventLog.enabled()) {
            try {
                eventLog.append(event);
            } catch (RuntimeException e) {
                // the aggregate already has the event
                log.warn("Event log write failed: {}", e.getMessage());
                metrics.recordDroppedEvent("event_log");
            }
        }
    }

    private void drop(Throwable error) {
        AggregatorUnavailableException wrapped = error instanceof AggregatorUnavailableException a
            ? a
            : new AggregatorUnavailableException("Analytics scheduler unavailable: " + error.getMessage(), error);
        metrics.recordDroppedEvent(error instanceof RejectedExecutionException
            || error.getCause() instanceof RejectedExecutionException ? "saturated" : "aggregator_error");
        log.warn("Dropped prediction event: {}", wrapped.toString());
    }
}
