package io.riskradar.conversation.api.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Case-insensitive phrase lookup that never matches inside a longer word:
 * "issue" matches "an issue here" but not "issues" or "nonissue".
 * Whitespace inside a phrase matches any whitespace run, and a straight
 * apostrophe also matches a typographic one.
 */
public final class PhraseMatcher {

    private static final String WORD_CHAR = "[\\p{L}\\p{N}]";
    private static final Pattern WORD_START = Pattern.compile("^" + WORD_CHAR);
    private static final Pattern WORD_END = Pattern.compile(WORD_CHAR + "$");

    private final Map<String, Pattern> patterns;

    private PhraseMatcher(Map<String, Pattern> patterns) {
        this.patterns = patterns;
    }

    public static PhraseMatcher of(Collection<String> phrases) {
        Map<String, Pattern> compiled = new TreeMap<>();
        for (String phrase : phrases) {
            if (phrase == null || phrase.isBlank()) continue;

            String normalized = phrase.trim().toLowerCase(Locale.ROOT);
            compiled.computeIfAbsent(normalized, PhraseMatcher::compile);
        }
        return new PhraseMatcher(compiled);
    }

    /**
     * @return matching phrases in lexicographic order
     */
    public List<String> findAll(String text) {
        if (text == null || text.isBlank()) return List.of();

        List<String> found = new ArrayList<>();
        patterns.forEach((phrase, pattern) -> {
            if (pattern.matcher(text).find()) {
                found.add(phrase);
            }
        });
        return List.copyOf(found);
    }

    public boolean matchesAny(String text) {
        if (text == null || text.isBlank()) return false;

        return patterns.values().stream()
                .anyMatch(pattern -> pattern.matcher(text).find());
    }

    public int size() {
        return patterns.size();
    }

    private static Pattern compile(String phrase) {
        String body = Pattern.compile("\\s+").splitAsStream(phrase)
                .map(PhraseMatcher::literal)
                .collect(Collectors.joining("\\s+"));

        // Boundaries only apply at edges that are word characters, so "..." still matches after "ok".
        String prefix = WORD_START.matcher(phrase).find() ? "(?<!" + WORD_CHAR + ")" : "";
        String suffix = WORD_END.matcher(phrase).find() ? "(?!" + WORD_CHAR + ")" : "";

        return Pattern.compile(prefix + body + suffix, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String literal(String word) {
        String[] pieces = word.split("'", -1);
        List<String> quoted = new ArrayList<>(pieces.length);
        for (String piece : pieces) {
            quoted.add(piece.isEmpty() ? "" : Pattern.quote(piece));
        }
        return String.join("['’]", quoted);
    }
}
