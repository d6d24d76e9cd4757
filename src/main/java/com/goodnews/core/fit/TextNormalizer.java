package com.goodnews.core.fit;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Collapses whitespace and guarantees the fitting search never sees empty text.
 */
public final class TextNormalizer {
    /** Substituted for empty or whitespace-only input. */
    public static final String EMPTY_PLACEHOLDER = "内容为空";

    static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return EMPTY_PLACEHOLDER;
        }
        String collapsed = WHITESPACE.matcher(raw).replaceAll(" ").trim();
        return collapsed.isEmpty() ? EMPTY_PLACEHOLDER : collapsed;
    }

    static List<String> tokens(String text) {
        if (text == null) {
            return List.of();
        }
        return WHITESPACE.splitAsStream(text)
            .filter(token -> !token.isEmpty())
            .toList();
    }
}
