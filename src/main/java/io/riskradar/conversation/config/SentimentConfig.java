package io.riskradar.conversation.config;

import java.util.Map;

public record SentimentConfig(
        Double positiveCutoff,
        Double negativeCutoff,
        String lexiconResource,
        Map<String, Double> valenceOverrides
) {
    public static final String DEFAULT_LEXICON = "sentiment/lexicon.tsv";

    public SentimentConfig {
        positiveCutoff = positiveCutoff != null ? positiveCutoff : 0.05;
        negativeCutoff = negativeCutoff != null ? negativeCutoff : -0.05;
        lexiconResource = lexiconResource != null && !lexiconResource.isBlank() ? lexiconResource : DEFAULT_LEXICON;
        valenceOverrides = valenceOverrides != null ? Map.copyOf(valenceOverrides) : Map.of();

        if (positiveCutoff < negativeCutoff) {
            throw new IllegalArgumentException("risk.sentiment.positive-cutoff must not be below negative-cutoff");
        }
    }

    public static SentimentConfig defaults() {
        return new SentimentConfig(null, null, null, null);
    }
}
