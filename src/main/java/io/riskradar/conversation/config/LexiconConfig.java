package io.riskradar.conversation.config;

import java.util.List;
import java.util.Set;

public record LexiconConfig(
        List<String> riskKeywords,
        List<String> dismissivePatterns,
        Set<String> leadershipRoles,
        List<String> acknowledgmentPatterns,
        List<String> doubtPatterns
) {
    public LexiconConfig {
        riskKeywords = riskKeywords != null ? List.copyOf(riskKeywords) : List.of(
                "spike", "spikes", "anomaly", "anomalies", "weird", "thermal deviation", "not urgent but",
                "deviation", "deviations", "unusual", "abnormal", "drift", "fluctuation", "fluctuations",
                "issue", "issues", "bug", "bugs", "glitch", "glitches", "error", "errors", "warning",
                "warnings", "concern", "concerns", "problem", "problems", "malfunction", "failure",
                "failures", "fault", "faults", "defect", "defects", "inconsistent", "unexpected", "irregular"
        );
        dismissivePatterns = dismissivePatterns != null ? List.copyOf(dismissivePatterns) : List.of(
                "not a big deal", "probably nothing", "don't worry", "not critical", "no need to", "minor",
                "not urgent", "can ignore", "non-blocking", "not a showstopper", "not alarming",
                "within tolerance", "noise", "harmless", "nothing to worry about", "not a concern",
                "deemed non-blocking", "no criticals", "not prioritize", "all clear", "no red flags"
        );
        leadershipRoles = leadershipRoles != null ? Set.copyOf(leadershipRoles)
                : Set.of("PM_Lead", "Director", "QA_Tech", "Systems_Admin");
        acknowledgmentPatterns = acknowledgmentPatterns != null ? List.copyOf(acknowledgmentPatterns) : List.of(
                "resolved", "fixed", "false alarm", "never mind", "nevermind", "my mistake", "my bad",
                "all good now", "back to normal", "confirmed ok"
        );
        doubtPatterns = doubtPatterns != null ? List.copyOf(doubtPatterns) : List.of(
                "still", "not convinced", "hope", "guess", "documenting", "fingers crossed", "..."
        );
    }

    public static LexiconConfig defaults() {
        return new LexiconConfig(null, null, null, null, null);
    }
}
