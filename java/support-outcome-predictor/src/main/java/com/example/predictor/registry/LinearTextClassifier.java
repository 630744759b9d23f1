package com.example.predictor.registry;

import java.util.List;
import java.util.Map;

import com.example.predictor.model.Capability;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.ModelScore;

/**
 * Multinomial linear model over bag-of-words token features plus an issue-type prior.
 * Confidence is the softmax probability of the winning label.
 */
public class LinearTextClassifier implements ScoringUnit {

    private final Capability capability;
    private final String version;
    private final List<String> labels;
    private final double[] bias;
    private final Map<String, Map<String, Double>> tokenWeights;
    private final Map<String, Map<String, Double>> issueTypeWeights;

    public LinearTextClassifier(Capability capability, String version, List<String> labels,
                                Map<String, Double> bias,
                                Map<String, Map<String, Double>> tokenWeights,
                                Map<String, Map<String, Double>> issueTypeWeights) {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("linear_text model needs at least one label");
        }
        this.capability = capability;
        this.version = version;
        this.labels = List.copyOf(labels);
        this.bias = new double[labels.size()];
        for (int i = 0; i < labels.size(); i++) {
            this.bias[i] = bias != null ? bias.getOrDefault(labels.get(i), 0.0) : 0.0;
        }
        this.tokenWeights = tokenWeights != null ? Map.copyOf(tokenWeights) : Map.of();
        this.issueTypeWeights = issueTypeWeights != null ? Map.copyOf(issueTypeWeights) : Map.of();
    }

    @Override
    public Capability capability() {
        return capability;
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public ModelScore score(String message, IssueType issueType) {
        double[] logits = bias.clone();
        for (String token : TextTokenizer.tokenize(message)) {
            addWeights(logits, tokenWeights.get(token));
        }
        if (issueType != null) {
            addWeights(logits, issueTypeWeights.get(issueType.wireName()));
        }
        return best(softmax(logits));
    }

    private void addWeights(double[] logits, Map<String, Double> weights) {
        if (weights == null) return;
        for (int i = 0; i < labels.size(); i++) {
            Double w = weights.get(labels.get(i));
            if (w != null) {
                logits[i] += w;
            }
        }
    }

    private ModelScore best(double[] probabilities) {
        int winner = 0;
        for (int i = 1; i < probabilities.length; i++) {
            if (probabilities[i] > probabilities[winner]) {
                winner = i;
            }
        }
        return new ModelScore(labels.get(winner), Math.min(1.0, Math.max(0.0, probabilities[winner])));
    }

    static double[] softmax(double[] logits) {
        double max = Double.NEGATIVE_INFINITY;
        for (double l : logits) max = Math.max(max, l);
        double sum = 0.0;
        double[] out = new double[logits.length];
        for (int i = 0; i < logits.length; i++) {
            out[i] = Math.exp(logits[i] - max);
            sum += out[i];
        }
        for (int i = 0; i < out.length; i++) {
            out[i] /= sum;
        }
        return out;
    }
}
