package com.example.predictor.pipeline;

import com.example.predictor.model.ModelScore;
import com.example.predictor.model.Prediction;

/** A prediction together with the per-stage scores it was derived from. */
public record InferenceTrace(Prediction prediction, ModelScore intent, ModelScore sentiment) {}
