package com.example.predictor.pipeline;

import org.springframework.stereotype.Component;

import com.example.predictor.config.PredictionProperties;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.ModelScore;
import com.example.predictor.model.Priority;
import com.example.predictor.model.SatisfactionLevel;

/**
 * Response-priority heuristic: turns the sentiment score and the declared issue type into a
 * satisfaction level and a priority. Pure function of its inputs and configuration.
 */
@Component
public class DecisionPolicy {

    private final PredictionProperties properties;

    public DecisionPolicy(PredictionProperties properties) {
        this.properties = properties;
    }

    public SatisfactionLevel satisfaction(ModelScore sentiment) {
        if (sentiment.isUnknown()) {
            return SatisfactionLevel.MEDIUM;
        }
        boolean confident = sentiment.confidence() >= properties.satisfactionThreshold();
        if (confident && properties.negativeLabels().contains(sentiment.label())) {
            return SatisfactionLevel.LOW;
        }
        if (confident && properties.positiveLabels().contains(sentiment.label())) {
            return SatisfactionLevel.HIGH;
        }
        return SatisfactionLevel.MEDIUM;
    }

    public Priority priority(IssueType issueType, SatisfactionLevel satisfaction) {
        if (satisfaction == SatisfactionLevel.LOW && properties.highPriorityIssueTypes().contains(issueType)) {
            return Priority.HIGH;
        }
        if (satisfaction == SatisfactionLevel.HIGH) {
            return Priority.LOW;
        }
        return Priority.MEDIUM;
    }
}
