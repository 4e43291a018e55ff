package io.esgradar.materiality.api.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {

    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextNormalizer() {
    }

    /**
     * Strips markup and punctuation, collapses whitespace and lowercases.
     * Letters of every script survive, so Korean and English text normalize alike.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";

        String cleaned = TAGS.matcher(text).replaceAll(" ");
        cleaned = NON_WORD.matcher(cleaned).replaceAll(" ");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");

        return cleaned.trim().toLowerCase(Locale.ROOT);
    }

    public static List<String> tokenize(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) return List.of();

        return Arrays.asList(normalized.split(" "));
    }

    /**
     * Number of whitespace-separated words in the raw text.
     */
    public static int wordCount(String text) {
        if (text == null || text.isBlank()) return 0;
        return WHITESPACE.split(text.trim()).length;
    }
}
