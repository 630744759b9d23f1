package com.example.predictor.analytics;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.example.predictor.MutableClock;
import com.example.predictor.config.AnalyticsProperties;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.MetricBucket;
import com.example.predictor.model.Priority;
import com.example.predictor.model.SatisfactionLevel;

import static com.example.predictor.analytics.AnalyticsFixtures.event;
import static org.junit.jupiter.api.Assertions.*;

class BucketedAnalyticsAggregatorTest {

    private static final Instant START = Instant.parse("2025-06-02T10:00:05Z");

    private final MutableClock clock = new MutableClock(START);
    private final BucketedAnalyticsAggregator aggregator = new BucketedAnalyticsAggregator(
        new AnalyticsProperties(Duration.ofMinutes(1), Duration.ofMinutes(10), 0, 0, null), clock);

    @Test
    void countsAndStreamingMeansWithinOneBucket() {
        double[] confidences = {0.2, 0.9, 0.55, 0.35};
        long[] latencies = {10, 20, 30, 40};
        for (int i = 0; i < confidences.length; i++) {
            aggregator.record(event(confidences[i], latencies[i]));
        }

        List<MetricBucket> snapshot = aggregator.snapshot(null);
        assertEquals(1, snapshot.size());
        MetricBucket bucket = snapshot.get(0);
        assertEquals(4, bucket.count());
        assertEquals(0.5, bucket.avgConfidence(), 1e-9);
        assertEquals(25.0, bucket.avgLatencyMs(), 1e-9);
        assertEquals(Instant.parse("2025-06-02T10:00:00Z"), bucket.windowStart());
        assertEquals(Duration.ofMinutes(1), bucket.windowWidth());
    }

    @Test
    void histogramsTrackEveryDimension() {
        aggregator.record(event(SatisfactionLevel.LOW, Priority.HIGH, IssueType.COMPLAINT, "negative", 0.9, 5));
        aggregator.record(event(SatisfactionLevel.LOW, Priority.HIGH, IssueType.ACCOUNT_ACCESS, "negative", 0.8, 5));
        aggregator.record(event(SatisfactionLevel.HIGH, Priority.LOW, IssueType.COMPLIMENT, "positive", 0.7, 5));

        MetricBucket bucket = aggregator.snapshot(null).get(0);
        assertEquals(2L, bucket.satisfactionHistogram().get(SatisfactionLevel.LOW));
        assertEquals(1L, bucket.satisfactionHistogram().get(SatisfactionLevel.HIGH));
        assertEquals(2L, bucket.priorityHistogram().get(Priority.HIGH));
        assertEquals(1L, bucket.issueTypeHistogram().get(IssueType.COMPLIMENT));
        assertEquals(2L, bucket.sentimentHistogram().get("negative"));
        assertThrows(UnsupportedOperationException.class,
            () -> bucket.priorityHistogram().put(Priority.LOW, 99L));
    }

    @Test
    void separateWindowsGetSeparateBucketsInOrder() {
        aggregator.record(event(0.5, 1));
        clock.advance(Duration.ofMinutes(1));
        aggregator.record(event(0.5, 1));
        aggregator.record(event(0.5, 1));
        clock.advance(Duration.ofMinutes(2));
        aggregator.record(event(0.5, 1));

        List<MetricBucket> snapshot = aggregator.snapshot(null);
        assertEquals(List.of(1L, 2L, 1L), snapshot.stream().map(MetricBucket::count).toList());
        assertTrue(snapshot.get(0).windowStart().isBefore(snapshot.get(1).windowStart()));
        assertEquals(4, aggregator.totalRecorded());
    }

    @Test
    void snapshotIsACopy() {
        aggregator.record(event(0.5, 1));
        MetricBucket before = aggregator.snapshot(null).get(0);
        aggregator.record(event(0.5, 1));

        assertEquals(1, before.count());
        assertEquals(2, aggregator.snapshot(null).get(0).count());
    }

    @Test
    void bucketsOutsideRetentionAreEvicted() {
        aggregator.record(event(0.5, 1));
        clock.advance(Duration.ofMinutes(5));
        aggregator.record(event(0.5, 1));

        clock.advance(Duration.ofMinutes(7));
        List<MetricBucket> snapshot = aggregator.snapshot(null);

        Instant horizon = clock.instant().minus(Duration.ofMinutes(10));
        assertEquals(1, snapshot.size());
        for (MetricBucket bucket : snapshot) {
            assertTrue(bucket.windowStart().plus(bucket.windowWidth()).isAfter(horizon));
        }

        clock.advance(Duration.ofMinutes(20));
        assertTrue(aggregator.snapshot(null).isEmpty());
        assertEquals(2, aggregator.totalRecorded());
    }

    @Test
    void windowNarrowsTheSnapshot() {
        aggregator.record(event(0.5, 1));
        clock.advance(Duration.ofMinutes(5));
        aggregator.record(event(0.5, 1));

        assertEquals(2, aggregator.snapshot(null).size());
        assertEquals(1, aggregator.snapshot(Duration.ofMinutes(2)).size());
    }

    @Test
    void resetClearsEverything() {
        aggregator.record(event(0.5, 1));
        aggregator.reset();

        assertTrue(aggregator.snapshot(null).isEmpty());
        assertEquals(0, aggregator.totalRecorded());
    }

    @Test
    void concurrentRecordsAreAllCounted() throws InterruptedException {
        int writers = 100;
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(writers);
        try {
            for (int i = 0; i < writers; i++) {
                double confidence = (i % 10) / 10.0;
                pool.execute(() -> {
                    try {
                        start.await();
                        aggregator.record(event(confidence, 10));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        MetricBucket bucket = aggregator.snapshot(null).get(0);
        assertEquals(100, bucket.count());
        assertEquals(0.45, bucket.avgConfidence(), 1e-9);
        assertEquals(100, aggregator.totalRecorded());
    }

    @Test
    void retentionShorterThanBucketIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new AnalyticsProperties(Duration.ofMinutes(5), Duration.ofMinutes(1), 0, 0, null));
    }
}
