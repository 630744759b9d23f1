package com.example.predictor.insights;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.predictor.llm.LlmResponse;
import com.example.predictor.llm.LlmService;

@Component
public class LlmInsightBackend implements InsightBackend {

    private static final Logger log = LoggerFactory.getLogger(LlmInsightBackend.class);

    private final LlmService llmService;

    public LlmInsightBackend(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        LlmResponse response = llmService.generate(systemPrompt, userPrompt, "insights");
        log.debug("Insight completion from {}/{}: {} output tokens",
            response.provider(), response.model(), response.outputTokens());
        return response.content();
    }
}
