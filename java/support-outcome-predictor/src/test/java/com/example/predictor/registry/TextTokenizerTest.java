package com.example.predictor.registry;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextTokenizerTest {

    @Test
    void lowercasesAndSplitsOnPunctuation() {
        assertEquals(List.of("i", "cannot", "log", "into", "my", "account"),
            TextTokenizer.tokenize("I cannot log into my account!!"));
    }

    @Test
    void keepsContractions() {
        assertEquals(List.of("i", "don't", "know", "why", "it", "won't", "load"),
            TextTokenizer.tokenize("I don’t know why it WON'T load"));
    }

    @Test
    void emptyTextHasNoTokens() {
        assertTrue(TextTokenizer.tokenize("  ?! ").isEmpty());
    }

    @Test
    void nullIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TextTokenizer.tokenize(null));
    }
}
