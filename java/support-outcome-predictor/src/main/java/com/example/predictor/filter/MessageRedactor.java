package com.example.predictor.filter;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;

/**
 * Masks personal data in customer messages before they are written to logs, the event log or
 * an LLM prompt. Predictions themselves always run on the original text.
 */
@Component
public class MessageRedactor {

    private static final Logger log = LoggerFactory.getLogger(MessageRedactor.class);
    static final String REDACTED = "[REDACTED]";

    public record Redaction(String text, List<String> kinds) {
        public boolean redacted() {
            return !kinds.isEmpty();
        }
    }

    private record SensitivePattern(String kind, Pattern pattern) {}

    // Card before phone: a 16-digit run also matches the phone pattern.
    private static final List<SensitivePattern> PATTERNS = List.of(
        new SensitivePattern("email",
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b")),
        new SensitivePattern("ssn",
            Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b")),
        new SensitivePattern("credit_card",
            Pattern.compile("\\b\\d{4}[- ]?\\d{4}[- ]?\\d{4}[- ]?\\d{4}\\b")),
        new SensitivePattern("phone",
            Pattern.compile("(?:\\+?1[-.]?)?\\(?\\d{3}\\)?[-.]?\\d{3}[-.]?\\d{4}"))
    );

    public Redaction redact(String text) {
        if (text == null || text.isEmpty()) {
            return new Redaction(text, List.of());
        }

        String result = text;
        List<String> kinds = new ArrayList<>();
        for (var sensitive : PATTERNS) {
            var matcher = sensitive.pattern().matcher(result);
            if (matcher.find()) {
                kinds.add(sensitive.kind());
                result = matcher.replaceAll(REDACTED);
            }
        }

        if (!kinds.isEmpty()) {
            log.debug("Redacted {} from message", kinds);
            Span.current().addEvent("predictor.pii_redacted", Attributes.of(
                AttributeKey.stringArrayKey("predictor.pii_kinds"), kinds
            ));
        }
        return new Redaction(result, List.copyOf(kinds));
    }

    public String scrub(String text) {
        return redact(text).text();
    }

    /** Redacted and cut to {@code max} characters, for log lines. */
    public String preview(String text, int max) {
        String scrubbed = scrub(text);
        if (scrubbed == null) return "";
        return scrubbed.length() > max ? scrubbed.substring(0, max) + "..." : scrubbed;
    }
}
