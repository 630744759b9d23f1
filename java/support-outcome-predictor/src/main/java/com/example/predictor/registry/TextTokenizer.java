package com.example.predictor.registry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class TextTokenizer {

    private static final Pattern TOKEN = Pattern.compile("[a-z0-9]+(?:'[a-z]+)?");

    private TextTokenizer() {}

    static List<String> tokenize(String text) {
        if (text == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        String normalized = text.toLowerCase(Locale.ROOT).replace('’', '\'');
        Matcher matcher = TOKEN.matcher(normalized);
        List<String> tokens = new ArrayList<>();
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }
}
