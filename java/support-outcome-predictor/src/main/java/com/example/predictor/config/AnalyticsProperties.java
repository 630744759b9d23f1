package com.example.predictor.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.analytics")
public record AnalyticsProperties(
    Duration bucketWidth,
    Duration retention,
    int publisherThreads,
    int publisherQueueCapacity,
    String eventLog
) {

    public AnalyticsProperties {
        bucketWidth = bucketWidth == null ? Duration.ofMinutes(1) : bucketWidth;
        retention = retention == null ? Duration.ofHours(1) : retention;
        if (bucketWidth.isZero() || bucketWidth.isNegative()) {
            throw new IllegalArgumentException("app.analytics.bucket-width must be positive");
        }
        if (retention.compareTo(bucketWidth) < 0) {
            throw new IllegalArgumentException("app.analytics.retention must be at least one bucket width");
        }
        publisherThreads = publisherThreads > 0 ? publisherThreads : 2;
        publisherQueueCapacity = publisherQueueCapacity > 0 ? publisherQueueCapacity : 10_000;
        eventLog = eventLog == null ? "" : eventLog.strip();
    }

    public static AnalyticsProperties defaults() {
        return new AnalyticsProperties(null, null, 0, 0, null);
    }

    public boolean eventLogEnabled() {
        return !eventLog.isEmpty();
    }
}
