package com.example.predictor.registry;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.predictor.model.Capability;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.ModelScore;

import static org.junit.jupiter.api.Assertions.*;

class LinearTextClassifierTest {

    private final LinearTextClassifier classifier = new LinearTextClassifier(
        Capability.INTENT, "test",
        List.of("account", "billing"),
        Map.of(),
        Map.of("login", Map.of("account", 2.0)),
        Map.of("billing", Map.of("billing", 3.0)));

    @Test
    void tokenWeightsPickTheLabel() {
        ModelScore score = classifier.score("Login please", IssueType.GENERAL);
        assertEquals("account", score.label());
        assertEquals(Math.exp(2) / (Math.exp(2) + 1), score.confidence(), 1e-9);
    }

    @Test
    void issueTypePriorCanOutweighTokens() {
        ModelScore score = classifier.score("login", IssueType.BILLING);
        assertEquals("billing", score.label());
        assertEquals(Math.exp(3) / (Math.exp(2) + Math.exp(3)), score.confidence(), 1e-9);
    }

    @Test
    void tieGoesToFirstLabel() {
        ModelScore score = classifier.score("hello there", IssueType.GENERAL);
        assertEquals("account", score.label());
        assertEquals(0.5, score.confidence(), 1e-9);
    }

    @Test
    void softmaxIsStableForLargeLogits() {
        double[] p = LinearTextClassifier.softmax(new double[] {1000.0, 999.0, -1000.0});
        assertEquals(1.0, p[0] + p[1] + p[2], 1e-9);
        assertTrue(p[0] > p[1]);
        assertFalse(Double.isNaN(p[2]));
    }

    @Test
    void requiresLabels() {
        assertThrows(IllegalArgumentException.class, () -> new LinearTextClassifier(
            Capability.INTENT, "x", List.of(), null, null, null));
    }
}
