package com.example.predictor.registry;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * On-disk form of a trained model as exported by the training job. Only the fields of the
 * declared {@code family} are read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ModelArtifact(
    String capability,
    String version,
    String family,
    String trainedAt,
    // linear_text
    List<String> labels,
    Map<String, Double> bias,
    Map<String, Map<String, Double>> tokenWeights,
    Map<String, Map<String, Double>> issueTypeWeights,
    // polarity_lexicon
    Map<String, Double> lexicon,
    Map<String, Double> intensifiers,
    List<String> negations,
    Integer negationWindow,
    Double neutralBand,
    Double scale
) {}
