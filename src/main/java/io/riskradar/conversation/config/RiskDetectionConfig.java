package io.riskradar.conversation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable detection configuration bound from the {@code risk.*} properties.
 * Any section left out of the configuration falls back to its documented defaults.
 */
@ConfigurationProperties(prefix = "risk")
public record RiskDetectionConfig(
        LexiconConfig lexicon,
        SentimentConfig sentiment,
        ClusteringConfig clustering,
        GapConfig gaps,
        SeverityConfig severity,
        ProcessingConfig processing,
        InputConfig input,
        Map<String, List<String>> themes
) {
    public RiskDetectionConfig {
        lexicon = lexicon != null ? lexicon : LexiconConfig.defaults();
        sentiment = sentiment != null ? sentiment : SentimentConfig.defaults();
        clustering = clustering != null ? clustering : ClusteringConfig.defaults();
        gaps = gaps != null ? gaps : GapConfig.defaults();
        severity = severity != null ? severity : SeverityConfig.defaults();
        processing = processing != null ? processing : ProcessingConfig.defaults();
        input = input != null ? input : InputConfig.defaults();
        themes = themes != null && !themes.isEmpty()
                ? copyThemes(themes)
                : defaultThemes();
    }

    public static RiskDetectionConfig defaults() {
        return new RiskDetectionConfig(null, null, null, null, null, null, null, null);
    }

    public RiskDetectionConfig withClustering(ClusteringConfig clustering) {
        return new RiskDetectionConfig(lexicon, sentiment, clustering, gaps, severity, processing, input, themes);
    }

    public RiskDetectionConfig withGaps(GapConfig gaps) {
        return new RiskDetectionConfig(lexicon, sentiment, clustering, gaps, severity, processing, input, themes);
    }

    public RiskDetectionConfig withProcessing(ProcessingConfig processing) {
        return new RiskDetectionConfig(lexicon, sentiment, clustering, gaps, severity, processing, input, themes);
    }

    private static Map<String, List<String>> copyThemes(Map<String, List<String>> themes) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        themes.forEach((theme, keywords) -> copy.put(theme, List.copyOf(keywords)));
        return Map.copyOf(copy);
    }

    private static Map<String, List<String>> defaultThemes() {
        return Map.of(
                "Thermal Issues", List.of("thermal", "temperature", "heat", "hot", "warm", "panel"),
                "Sensor Problems", List.of("sensor", "reading", "data", "log", "measurement", "diagnostic"),
                "Anomalies", List.of("anomaly", "spike", "deviation", "drift", "fluctuation", "weird"),
                "Communication Issues", List.of("not prioritize", "ignoring", "dismissed", "overlooked", "defer"),
                "System Concerns", List.of("system", "electrical", "hardware", "software", "component")
        );
    }
}
