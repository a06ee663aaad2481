package io.riskradar.conversation.config;

import java.time.Duration;
import java.util.List;

/**
 * @param similarityThreshold minimum cosine similarity (inclusive) linking two risk messages
 * @param stopWords tokens dropped before vectorizing
 * @param responseHorizon how far after a risk message a reply may still be attached to its cluster
 */
public record ClusteringConfig(
        Double similarityThreshold,
        List<String> stopWords,
        Duration responseHorizon
) {
    public ClusteringConfig {
        similarityThreshold = similarityThreshold != null ? similarityThreshold : 0.3;
        stopWords = stopWords != null ? List.copyOf(stopWords) : List.of(
                "a", "an", "and", "are", "as", "at", "be", "been", "but", "by", "for", "from", "has", "have",
                "i", "in", "is", "it", "its", "of", "on", "or", "our", "so", "that", "the", "their", "this",
                "to", "was", "we", "were", "with", "you"
        );
        responseHorizon = responseHorizon != null ? responseHorizon : Duration.ofMinutes(15);

        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("risk.clustering.similarity-threshold must be within [0, 1]");
        }
    }

    public static ClusteringConfig defaults() {
        return new ClusteringConfig(null, null, null);
    }

    public ClusteringConfig withSimilarityThreshold(double threshold) {
        return new ClusteringConfig(threshold, stopWords, responseHorizon);
    }
}
