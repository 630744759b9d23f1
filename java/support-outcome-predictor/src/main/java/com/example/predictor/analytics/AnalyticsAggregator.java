package com.example.predictor.analytics;

import java.time.Duration;
import java.util.List;

import com.example.predictor.model.MetricBucket;
import com.example.predictor.model.PredictionEvent;

/**
 * Rolling, time-bucketed view over served predictions. Safe for many concurrent writers.
 */
public interface AnalyticsAggregator {

    void record(PredictionEvent event);

    /**
     * Buckets in ascending window order, copied. A {@code null} window means everything
     * still inside retention.
     */
    List<MetricBucket> snapshot(Duration window);

    void reset();

    /** Events recorded since startup or the last reset, including evicted ones. */
    long totalRecorded();
}
