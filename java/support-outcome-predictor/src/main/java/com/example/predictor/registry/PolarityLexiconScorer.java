package com.example.predictor.registry;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.example.predictor.model.Capability;
import com.example.predictor.model.IssueType;
import com.example.predictor.model.ModelScore;

/**
 * Lexicon sentiment model. Term polarities are summed; an intensifier scales the term right
 * after it and a negation flips the next polar term inside its window.
 */
public class PolarityLexiconScorer implements ScoringUnit {

    static final String POSITIVE = "positive";
    static final String NEGATIVE = "negative";
    static final String NEUTRAL = "neutral";

    private final Capability capability;
    private final String version;
    private final Map<String, Double> lexicon;
    private final Map<String, Double> intensifiers;
    private final Set<String> negations;
    private final int negationWindow;
    private final double neutralBand;
    private final double scale;

    public PolarityLexiconScorer(Capability capability, String version,
                                 Map<String, Double> lexicon, Map<String, Double> intensifiers,
                                 List<String> negations, int negationWindow,
                                 double neutralBand, double scale) {
        if (lexicon == null || lexicon.isEmpty()) {
            throw new IllegalArgumentException("polarity_lexicon model needs a non-empty lexicon");
        }
        if (scale <= 0.0) {
            throw new IllegalArgumentException("scale must be positive: " + scale);
        }
        this.capability = capability;
        this.version = version;
        this.lexicon = Map.copyOf(lexicon);
        this.intensifiers = intensifiers != null ? Map.copyOf(intensifiers) : Map.of();
        this.negations = negations != null ? Set.copyOf(negations) : Set.of();
        this.negationWindow = negationWindow;
        this.neutralBand = neutralBand;
        this.scale = scale;
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
        double polarity = polarity(TextTokenizer.tokenize(message));
        double strength = Math.tanh(Math.abs(polarity) / scale);
        if (polarity <= -neutralBand) {
            return new ModelScore(NEGATIVE, strength);
        }
        if (polarity >= neutralBand) {
            return new ModelScore(POSITIVE, strength);
        }
        return new ModelScore(NEUTRAL, 1.0 - strength);
    }

    double polarity(List<String> tokens) {
        double total = 0.0;
        double boost = 1.0;
        int negationLeft = 0;
        for (String token : tokens) {
            if (negations.contains(token)) {
                negationLeft = negationWindow;
                boost = 1.0;
                continue;
            }
            Double factor = intensifiers.get(token);
            if (factor != null) {
                boost = factor;
                if (negationLeft > 0) negationLeft--;
                continue;
            }
            Double weight = lexicon.get(token);
            if (weight != null) {
                double contribution = weight * boost;
                if (negationLeft > 0) {
                    contribution = -contribution;
                    negationLeft = 0;
                }
                total += contribution;
            } else if (negationLeft > 0) {
                negationLeft--;
            }
            boost = 1.0;
        }
        return total;
    }
}
