package com.example.predictor.insights;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import com.example.predictor.exception.InsightsBackendException;
import com.example.predictor.insights.InsightResponseParser.ParsedInsight;

import static org.junit.jupiter.api.Assertions.*;

class InsightResponseParserTest {

    @Test
    void parsesPlainJson() {
        ParsedInsight parsed = InsightResponseParser.parse("""
            {"summary": "Escalations are up.", "recommendations": ["Staff the login queue", "Audit billing"], "alerts": []}
            """);

        assertEquals("Escalations are up.", parsed.summary());
        assertEquals(List.of("Staff the login queue", "Audit billing"), parsed.recommendations());
        assertEquals(List.of(), parsed.alerts());
    }

    @Test
    void stripsMarkdownFenceAndChatter() {
        ParsedInsight parsed = InsightResponseParser.parse("""
            ```json
            Here is the analysis:
            {"summary": "All calm.", "recommendations": "Keep going", "alerts": ["", "Spike in complaints"]}
            Hope this helps!
            ```
            """);

        assertEquals("All calm.", parsed.summary());
        assertEquals(List.of("Keep going"), parsed.recommendations());
        assertEquals(List.of("Spike in complaints"), parsed.alerts());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {
        "I could not analyze the data.",
        "{\"summary\": ",
        "{\"recommendations\": [\"x\"]}",
        "{\"summary\": \"   \"}"
    })
    void rejectsUnusableCompletions(String completion) {
        assertThrows(InsightsBackendException.class, () -> InsightResponseParser.parse(completion));
    }
}
