package io.riskradar.conversation.api.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextTokenizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextTokenizer() {
    }

    /**
     * Lowercase letter/digit runs, split on whitespace and punctuation.
     */
    public static List<String> words(String text) {
        if (text == null || text.isBlank()) return List.of();

        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
                .filter(token -> !token.isEmpty())
                .toList();
    }
}
