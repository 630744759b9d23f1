package com.example.predictor.filter;

import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.junit.jupiter.api.Assertions.*;

class MessageRedactorTest {

    private final MessageRedactor redactor = new MessageRedactor();

    static Stream<Arguments> sensitiveCases() {
        return Stream.of(
            Arguments.of("My login is jane.doe@example.com and it fails",
                "My login is [REDACTED] and it fails", List.of("email")),
            Arguments.of("SSN 123-45-6789 on the form", "SSN [REDACTED] on the form", List.of("ssn")),
            Arguments.of("Charged twice on 4111 1111 1111 1111", "Charged twice on [REDACTED]", List.of("credit_card")),
            Arguments.of("Call me back at (555)123-4567", "Call me back at [REDACTED]", List.of("phone")),
            Arguments.of("Email a@b.co, card 4000-0000-0000-0000",
                "Email [REDACTED], card [REDACTED]", List.of("email", "credit_card"))
        );
    }

    @ParameterizedTest
    @MethodSource("sensitiveCases")
    void redactsSensitiveData(String input, String expected, List<String> kinds) {
        var redaction = redactor.redact(input);

        assertEquals(expected, redaction.text());
        assertEquals(kinds, redaction.kinds());
        assertTrue(redaction.redacted());
    }

    @ParameterizedTest
    @NullAndEmptySource
    void handlesNullAndEmpty(String input) {
        assertEquals(input, redactor.scrub(input));
    }

    @Test
    void leavesOrdinaryComplaintsAlone() {
        String clean = "I cannot log into my account and I am very frustrated!";
        var redaction = redactor.redact(clean);

        assertEquals(clean, redaction.text());
        assertFalse(redaction.redacted());
    }

    @Test
    void previewTruncatesAfterRedaction() {
        assertEquals("Write to [REDACTED] ...", redactor.preview("Write to bob@example.com today please", 20));
        assertEquals("short", redactor.preview("short", 20));
        assertEquals("", redactor.preview(null, 20));
    }
}
