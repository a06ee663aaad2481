package io.riskradar.conversation.api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Word and phrase valences on a -4..+4 scale, read from a tab-separated classpath resource.
 */
public final class SentimentLexicon {

    private static final Logger logger = LoggerFactory.getLogger(SentimentLexicon.class);

    private final Map<String, Double> words;
    private final Map<String, List<Phrase>> phrasesByFirstWord;

    private SentimentLexicon(Map<String, Double> words, Map<String, List<Phrase>> phrasesByFirstWord) {
        this.words = words;
        this.phrasesByFirstWord = phrasesByFirstWord;
    }

    public static SentimentLexicon load(String resource, Map<String, Double> overrides) {
        Map<String, Double> entries = new HashMap<>(readResource(resource));
        overrides.forEach((term, valence) -> entries.put(normalize(term), valence));

        Map<String, Double> words = new HashMap<>();
        Map<String, List<Phrase>> phrases = new HashMap<>();

        entries.forEach((term, valence) -> {
            String[] parts = term.split(" ");
            if (parts.length == 1) {
                words.put(term, valence);
            } else {
                phrases.computeIfAbsent(parts[0], first -> new ArrayList<>())
                        .add(new Phrase(List.of(parts), valence));
            }
        });
        phrases.values().forEach(list -> list.sort(
                Comparator.comparingInt((Phrase phrase) -> phrase.words().size()).reversed()
                        .thenComparing(phrase -> String.join(" ", phrase.words()))));

        logger.info("Sentiment lexicon loaded from {}: {} words, {} phrases, {} overrides",
                resource, words.size(), phrases.values().stream().mapToInt(List::size).sum(), overrides.size());

        return new SentimentLexicon(Map.copyOf(words), Map.copyOf(phrases));
    }

    public Double valenceOf(String word) {
        return words.get(word);
    }

    /**
     * Phrases beginning with {@code first}, longest first. The caller checks the following words.
     */
    public List<Phrase> phrasesStartingWith(String first) {
        return phrasesByFirstWord.getOrDefault(first, List.of());
    }

    private static Map<String, Double> readResource(String resource) {
        InputStream stream = SentimentLexicon.class.getClassLoader().getResourceAsStream(resource);
        if (stream == null) {
            throw new IllegalStateException("Sentiment lexicon not found on classpath: " + resource);
        }

        Map<String, Double> entries = new HashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;

                String[] columns = trimmed.split("\t");
                if (columns.length < 2) {
                    logger.warn("Skipping malformed lexicon line {} in {}: '{}'", lineNumber, resource, trimmed);
                    continue;
                }
                entries.put(normalize(columns[0]), Double.parseDouble(columns[1].trim()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read sentiment lexicon " + resource, e);
        }
        return entries;
    }

    private static String normalize(String term) {
        return String.join(" ", Arrays.stream(term.trim().toLowerCase(Locale.ROOT).split("\\s+"))
                .map(word -> word.replace('’', '\''))
                .toList());
    }

    public record Phrase(List<String> words, double valence) {}
}
