package com.example.predictor.registry;

import com.example.predictor.model.Capability;

final class ScoringUnitFactory {

    static final String LINEAR_TEXT = "linear_text";
    static final String POLARITY_LEXICON = "polarity_lexicon";

    private ScoringUnitFactory() {}

    static ScoringUnit create(ModelArtifact artifact) {
        Capability capability = Capability.fromWire(artifact.capability())
            .orElseThrow(() -> new IllegalArgumentException("Unknown capability: " + artifact.capability()));
        if (artifact.version() == null || artifact.version().isBlank()) {
            throw new IllegalArgumentException("Artifact for " + capability.wireName() + " has no version");
        }
        String family = artifact.family() == null ? "" : artifact.family().strip().toLowerCase();

        return switch (family) {
            case LINEAR_TEXT -> new LinearTextClassifier(capability, artifact.version(),
                artifact.labels(), artifact.bias(), artifact.tokenWeights(), artifact.issueTypeWeights());
            case POLARITY_LEXICON -> new PolarityLexiconScorer(capability, artifact.version(),
                artifact.lexicon(), artifact.intensifiers(), artifact.negations(),
                artifact.negationWindow() != null ? artifact.negationWindow() : 3,
                artifact.neutralBand() != null ? artifact.neutralBand() : 0.5,
                artifact.scale() != null ? artifact.scale() : 2.0);
            default -> throw new IllegalArgumentException("Unknown model family: '" + artifact.family() + "'");
        };
    }
}
