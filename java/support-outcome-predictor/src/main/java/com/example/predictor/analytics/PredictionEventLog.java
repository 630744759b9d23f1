package com.example.predictor.analytics;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.predictor.config.AnalyticsProperties;
import com.example.predictor.filter.MessageRedactor;
import com.example.predictor.model.Prediction;
import com.example.predictor.model.PredictionEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Optional append-only JSON Lines log of prediction events. Messages are redacted before they
 * touch disk. Disabled when {@code app.analytics.event-log} is empty.
 */
@Component
public class PredictionEventLog {

    private static final Logger log = LoggerFactory.getLogger(PredictionEventLog.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final Path path;
    private final MessageRedactor redactor;

    public PredictionEventLog(AnalyticsProperties properties, MessageRedactor redactor) {
        this.path = properties.eventLogEnabled() ? Path.of(properties.eventLog()) : null;
        this.redactor = redactor;
        if (path != null) {
            log.info("Prediction event log enabled: {}", path.toAbsolutePath());
        }
    }

    public boolean enabled() {
        return path != null;
    }

    public void append(PredictionEvent event) {
        if (path == null) return;
        String line = toJsonLine(event);
        synchronized (this) {
            try {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                    writer.write(line);
                    writer.write('\n');
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot append to event log " + path, e);
            }
        }
    }

    String toJsonLine(PredictionEvent event) {
        Prediction p = event.prediction();
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", p.timestamp().toString());
        row.put("message", redactor.scrub(p.message()));
        row.put("issue_type", p.issueType().wireName());
        row.put("predicted_satisfaction", p.predictedSatisfaction().wireName());
        row.put("recommended_priority", p.recommendedPriority().wireName());
        row.put("confidence", p.confidence());
        row.put("intent", event.intent() != null ? event.intent().label() : null);
        row.put("sentiment", event.sentiment() != null ? event.sentiment().label() : null);
        row.put("latency_ms", event.latencyMs());
        try {
            return mapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize prediction event", e);
        }
    }
}
