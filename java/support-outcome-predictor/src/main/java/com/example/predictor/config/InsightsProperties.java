package com.example.predictor.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.insights")
public record InsightsProperties(
    boolean scheduleEnabled,
    Duration refreshInterval,
    Duration timeout,
    int minNewPredictions,
    int maxPromptBuckets,
    int maxPromptChars
) {

    public InsightsProperties {
        refreshInterval = refreshInterval == null ? Duration.ofSeconds(10) : refreshInterval;
        timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
        minNewPredictions = Math.max(minNewPredictions, 0);
        maxPromptBuckets = maxPromptBuckets > 0 ? maxPromptBuckets : 30;
        maxPromptChars = maxPromptChars > 0 ? maxPromptChars : 4000;
    }

    public static InsightsProperties defaults() {
        return new InsightsProperties(true, null, null, 5, 0, 0);
    }
}
