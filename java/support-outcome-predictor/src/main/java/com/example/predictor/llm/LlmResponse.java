package com.example.predictor.llm;

public record LlmResponse(
    String content,
    String model,
    String provider,
    int inputTokens,
    int outputTokens,
    String finishReason
) {}
