package com.example.predictor.analytics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.predictor.config.AnalyticsProperties;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.MetricBucket;
import com.example.predictor.model.Prediction;
import com.example.predictor.model.PredictionEvent;
import com.example.predictor.model.Priority;
import com.example.predictor.model.SatisfactionLevel;

/**
 * In-memory aggregator keyed by aligned window start. Each bucket carries its own lock, so
 * writers only contend when they land in the same window; readers copy bucket by bucket.
 * Buckets behind the retention horizon are dropped lazily on the next record or snapshot.
 */
@Component
public class BucketedAnalyticsAggregator implements AnalyticsAggregator {

    private static final Logger log = LoggerFactory.getLogger(BucketedAnalyticsAggregator.class);

    private final Clock clock;
    private final long widthMillis;
    private final Duration width;
    private final long retentionMillis;
    private final ConcurrentSkipListMap<Long, MutableBucket> buckets = new ConcurrentSkipListMap<>();
    private final AtomicLong total = new AtomicLong();

    public BucketedAnalyticsAggregator(AnalyticsProperties properties, Clock clock) {
        this.clock = clock;
        this.width = properties.bucketWidth();
        this.widthMillis = properties.bucketWidth().toMillis();
        this.retentionMillis = properties.retention().toMillis();
    }

    @Override
    public void record(PredictionEvent event) {
        long now = clock.millis();
        evictBefore(now - retentionMillis);

        long windowStart = Math.floorDiv(now, widthMillis) * widthMillis;
        MutableBucket bucket = buckets.computeIfAbsent(windowStart, MutableBucket::new);
        bucket.add(event);
        total.incrementAndGet();
    }

    @Override
    public List<MetricBucket> snapshot(Duration window) {
        long now = clock.millis();
        long retentionCutoff = now - retentionMillis;
        evictBefore(retentionCutoff);

        long cutoff = retentionCutoff;
        if (window != null && !window.isNegative() && !window.isZero()) {
            cutoff = Math.max(cutoff, now - window.toMillis());
        }
        // A bucket is kept while any part of it lies after the cutoff
        ConcurrentNavigableMap<Long, MutableBucket> visible = buckets.tailMap(cutoff - widthMillis, false);

        List<MetricBucket> copies = new ArrayList<>(visible.size());
        for (MutableBucket bucket : visible.values()) {
            copies.add(bucket.copy(width));
        }
        return Collections.unmodifiableList(copies);
    }

    @Override
    public void reset() {
        buckets.clear();
        total.set(0);
        log.info("Analytics buckets reset");
    }

    @Override
    public long totalRecorded() {
        return total.get();
    }

    private void evictBefore(long cutoffMillis) {
        // Only whole buckets that ended at or before the cutoff go
        var expired = buckets.headMap(cutoffMillis - widthMillis, true);
        if (!expired.isEmpty()) {
            int n = expired.size();
            expired.clear();
            log.debug("Evicted {} expired analytics buckets", n);
        }
    }

    private static final class MutableBucket {

        private final long windowStart;
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<SatisfactionLevel, Long> satisfaction = new EnumMap<>(SatisfactionLevel.class);
        private final Map<Priority, Long> priority = new EnumMap<>(Priority.class);
        private final Map<IssueType, Long> issueTypes = new EnumMap<>(IssueType.class);
        private final Map<String, Long> sentiment = new HashMap<>();
        private long count;
        private double avgConfidence;
        private double avgLatencyMs;

        MutableBucket(long windowStart) {
            this.windowStart = windowStart;
        }

        void add(PredictionEvent event) {
            Prediction p = event.prediction();
            lock.lock();
            try {
                count++;
                avgConfidence += (p.confidence() - avgConfidence) / count;
                avgLatencyMs += (event.latencyMs() - avgLatencyMs) / count;
                satisfaction.merge(p.predictedSatisfaction(), 1L, Long::sum);
                priority.merge(p.recommendedPriority(), 1L, Long::sum);
                issueTypes.merge(p.issueType(), 1L, Long::sum);
                if (event.sentiment() != null) {
                    sentiment.merge(event.sentiment().label(), 1L, Long::sum);
                }
            } finally {
                lock.unlock();
            }
        }

        MetricBucket copy(Duration width) {
            lock.lock();
            try {
                return new MetricBucket(
                    Instant.ofEpochMilli(windowStart), width, count,
                    Collections.unmodifiableMap(new EnumMap<>(satisfaction)),
                    Collections.unmodifiableMap(new EnumMap<>(priority)),
                    Collections.unmodifiableMap(new EnumMap<>(issueTypes)),
                    Map.copyOf(sentiment),
                    avgConfidence, avgLatencyMs);
            } finally {
                lock.unlock();
            }
        }
    }
}
