package com.example.predictor.registry;

import com.example.predictor.model.Capability;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.ModelScore;

/**
 * Minimal contract a model must satisfy to take part in the inference chain.
 *
 * <p>Implementations are synchronous and must not touch shared process state. Failures are
 * reported as {@link com.example.predictor.exception.ScoringException}; units handed out by a
 * {@link ModelRegistry} guarantee no other runtime exception escapes.
 */
public interface ScoringUnit {

    Capability capability();

    String version();

    ModelScore score(String message, IssueType issueType);
}
