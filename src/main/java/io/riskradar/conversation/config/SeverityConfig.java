package io.riskradar.conversation.config;

import java.util.List;

public record SeverityConfig(
        Double lowFlagRate,
        Double highFlagRate,
        Double mediumScore,
        Double highScore,
        List<String> highImpactKeywords,
        List<String> mediumImpactKeywords,
        List<String> lowImpactKeywords
) {
    public SeverityConfig {
        lowFlagRate = lowFlagRate != null ? lowFlagRate : 0.05;
        highFlagRate = highFlagRate != null ? highFlagRate : 0.15;
        mediumScore = mediumScore != null ? mediumScore : 4.0;
        highScore = highScore != null ? highScore : 7.0;
        highImpactKeywords = highImpactKeywords != null ? List.copyOf(highImpactKeywords)
                : List.of("critical", "serious", "significant", "major", "important", "dangerous");
        mediumImpactKeywords = mediumImpactKeywords != null ? List.copyOf(mediumImpactKeywords)
                : List.of("concerning", "notable", "unusual", "unexpected", "strange");
        lowImpactKeywords = lowImpactKeywords != null ? List.copyOf(lowImpactKeywords)
                : List.of("minor", "small", "slight", "tiny", "little");

        if (lowFlagRate > highFlagRate) {
            throw new IllegalArgumentException("risk.severity.low-flag-rate must not exceed high-flag-rate");
        }
        if (mediumScore > highScore) {
            throw new IllegalArgumentException("risk.severity.medium-score must not exceed high-score");
        }
    }

    public static SeverityConfig defaults() {
        return new SeverityConfig(null, null, null, null, null, null, null);
    }
}
