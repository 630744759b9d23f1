package com.example.predictor.registry;

import java.util.function.BiFunction;

import com.example.predictor.model.Capability;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.ModelScore;

public record StubScoringUnit(
    Capability capability,
    String version,
    BiFunction<String, IssueType, ModelScore> behaviour
) implements ScoringUnit {

    public static StubScoringUnit fixed(Capability capability, String version, String label, double confidence) {
        ModelScore score = new ModelScore(label, confidence);
        return new StubScoringUnit(capability, version, (m, t) -> score);
    }

    public static StubScoringUnit failing(Capability capability, String version, RuntimeException error) {
        return new StubScoringUnit(capability, version, (m, t) -> {
            throw error;
        });
    }

    @Override
    public ModelScore score(String message, IssueType issueType) {
        return behaviour.apply(message, issueType);
    }
}
