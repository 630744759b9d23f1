package com.example.predictor.model;

public record ModelScore(String label, double confidence) {

    public static final String UNKNOWN_LABEL = "unknown";

    public ModelScore {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of [0,1]: " + confidence);
        }
    }

    public static ModelScore unknown() {
        return new ModelScore(UNKNOWN_LABEL, 0.0);
    }

    public boolean isUnknown() {
        return UNKNOWN_LABEL.equals(label);
    }
}
