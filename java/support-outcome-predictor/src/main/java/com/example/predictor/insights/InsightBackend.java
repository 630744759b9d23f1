package com.example.predictor.insights;

/**
 * External natural-language generator used for insight summaries. Implementations may block
 * for a long time; callers bound them with their own timeout.
 */
public interface InsightBackend {

    String complete(String systemPrompt, String userPrompt);
}
