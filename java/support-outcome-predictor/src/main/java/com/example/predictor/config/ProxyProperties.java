package com.example.predictor.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.proxy")
public record ProxyProperties(
    boolean enabled,
    String upstreamUrl,
    Duration timeout
) {

    public ProxyProperties {
        upstreamUrl = upstreamUrl == null || upstreamUrl.isBlank() ? "http://localhost:8080" : upstreamUrl;
        timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
    }
}
