package com.example.predictor.llm;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import com.example.predictor.config.AppConfig;
import com.example.predictor.exception.InsightsBackendException;
import com.example.predictor.filter.MessageRedactor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmServiceTest {

    private final ChatModel ollama = mock(ChatModel.class);
    private final ChatModel openAi = mock(ChatModel.class);
    private final Map<String, ChatModel> chatModels = Map.of(
        "ollamaChatModel", ollama,
        "openAiChatModel", openAi);

    private static AppConfig config(String fallbackProvider) {
        return new AppConfig("ollama", "llama3.2:1b", fallbackProvider, "gpt-4o-mini", 256, 0.2, 1);
    }

    private static ChatResponse reply(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @ParameterizedTest
    @CsvSource({
        "'rate limit exceeded',          rate_limit",
        "'status 429: too many requests', rate_limit",
        "'context deadline exceeded: timeout', timeout",
        "'request timed out',            timeout",
        "'401 unauthorized',             auth_error",
        "'invalid api key',              auth_error",
        "'422 unprocessable entity',     invalid_request",
        "'503 service unavailable',      server_error",
        "'connection refused',           network_error",
        "'something unexpected',         unknown_error",
    })
    void classifyErrorCategories(String message, String expected) {
        var error = new RuntimeException(message);
        assertEquals(expected, LlmService.classifyError(error),
            "classifyError(\"" + message + "\") should be " + expected);
    }

    @Test
    void classifyErrorNull() {
        assertEquals("unknown_error", LlmService.classifyError(null));
    }

    @Test
    void primaryProviderAnswers() {
        when(ollama.call(any(Prompt.class))).thenReturn(reply("{\"summary\": \"ok\"}"));
        var service = new LlmService(chatModels, config("openai"), new MessageRedactor());

        LlmResponse response = service.generate("system", "user", "insights");

        assertEquals("{\"summary\": \"ok\"}", response.content());
        assertEquals("ollama", response.provider());
        assertEquals("llama3.2:1b", response.model());
        verify(openAi, never()).call(any(Prompt.class));
    }

    @Test
    void fallsBackWhenPrimaryFails() {
        when(ollama.call(any(Prompt.class))).thenThrow(new RuntimeException("connection refused"));
        when(openAi.call(any(Prompt.class))).thenReturn(reply("fallback answer"));
        var service = new LlmService(chatModels, config("openai"), new MessageRedactor());

        LlmResponse response = service.generate("system", "user", "insights");

        assertEquals("fallback answer", response.content());
        assertEquals("openai", response.provider());
        verify(ollama, times(1)).call(any(Prompt.class));
    }

    @Test
    void allProvidersFailing() {
        when(ollama.call(any(Prompt.class))).thenThrow(new RuntimeException("connection refused"));
        when(openAi.call(any(Prompt.class))).thenThrow(new RuntimeException("401 unauthorized"));
        var service = new LlmService(chatModels, config("openai"), new MessageRedactor());

        assertThrows(InsightsBackendException.class, () -> service.generate("system", "user", "insights"));
    }

    @Test
    void noFallbackConfigured() {
        when(ollama.call(any(Prompt.class))).thenThrow(new RuntimeException("connection refused"));
        var service = new LlmService(chatModels, config(""), new MessageRedactor());

        assertThrows(InsightsBackendException.class, () -> service.generate("system", "user", "insights"));
        verify(openAi, never()).call(any(Prompt.class));
    }

    @Test
    void unknownProviderIsRejectedAtStartup() {
        var bad = new AppConfig("google", "gemini", null, null, 256, 0.2, 1);
        assertThrows(IllegalArgumentException.class,
            () -> new LlmService(chatModels, bad, new MessageRedactor()));
    }
}
