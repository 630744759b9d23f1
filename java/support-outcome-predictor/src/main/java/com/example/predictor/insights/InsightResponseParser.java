package com.example.predictor.insights;

import java.util.ArrayList;
import java.util.List;

import com.example.predictor.exception.InsightsBackendException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Extracts {@code {summary, recommendations, alerts}} from a model completion. Markdown fences
 * and any chatter around the outermost braces are ignored.
 */
final class InsightResponseParser {

    private static final ObjectMapper mapper = new ObjectMapper();

    record ParsedInsight(String summary, List<String> recommendations, List<String> alerts) {}

    private InsightResponseParser() {}

    static ParsedInsight parse(String completion) {
        if (completion == null || completion.isBlank()) {
            throw new InsightsBackendException("Empty completion from insight backend");
        }
        String content = completion.strip();
        if (content.startsWith("```")) {
            content = content.replaceAll("```(?:json)?\\s*", "").replaceAll("```\\s*$", "").strip();
        }
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new InsightsBackendException("No JSON object in insight completion");
        }

        JsonNode root;
        try {
            root = mapper.readTree(content.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new InsightsBackendException("Unparseable insight completion: " + e.getOriginalMessage(), e);
        }

        String summary = root.path("summary").asText("").strip();
        if (summary.isEmpty()) {
            throw new InsightsBackendException("Insight completion has no summary");
        }
        return new ParsedInsight(summary, strings(root.path("recommendations")), strings(root.path("alerts")));
    }

    private static List<String> strings(JsonNode node) {
        if (node.isTextual()) {
            String text = node.asText().strip();
            return text.isEmpty() ? List.of() : List.of(text);
        }
        if (!node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            String text = item.asText("").strip();
            if (!text.isEmpty()) {
                values.add(text);
            }
        }
        return List.copyOf(values);
    }
}
