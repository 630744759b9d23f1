package com.example.predictor.config;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.example.predictor.model.Capability;
import com.example.predictor.model.IssueType;

/**
 * Decision thresholds and label mapping for the satisfaction/priority combination.
 * Model outputs differ between artifact families, so none of this is hard-coded.
 */
@ConfigurationProperties(prefix = "app.prediction")
public record PredictionProperties(
    double satisfactionThreshold,
    Set<String> negativeLabels,
    Set<String> positiveLabels,
    Set<IssueType> highPriorityIssueTypes,
    int maxMessageLength,
    Map<String, String> modelVersions
) {

    public PredictionProperties {
        if (satisfactionThreshold < 0.0 || satisfactionThreshold > 1.0) {
            throw new IllegalArgumentException(
                "app.prediction.satisfaction-threshold must be within [0,1]: " + satisfactionThreshold);
        }
        negativeLabels = negativeLabels == null ? Set.of("negative") : Set.copyOf(negativeLabels);
        positiveLabels = positiveLabels == null ? Set.of("positive") : Set.copyOf(positiveLabels);
        highPriorityIssueTypes = highPriorityIssueTypes == null
            ? Set.of(IssueType.COMPLAINT, IssueType.ACCOUNT_ACCESS)
            : Set.copyOf(highPriorityIssueTypes);
        maxMessageLength = maxMessageLength > 0 ? maxMessageLength : 5000;
        modelVersions = modelVersions == null ? Map.of() : Map.copyOf(modelVersions);
    }

    public static PredictionProperties defaults() {
        return new PredictionProperties(0.5, null, null, null, 0, null);
    }

    /** Pinned version for a capability, or empty for "latest loaded". */
    public Optional<String> pinnedVersion(Capability capability) {
        String version = modelVersions.get(capability.wireName());
        return version == null || version.isBlank() ? Optional.empty() : Optional.of(version);
    }
}
