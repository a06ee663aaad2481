package io.riskradar.conversation.api.dto;

import java.util.List;

public record KeywordMatch(
        List<String> riskKeywords,
        List<String> dismissivePatterns,
        boolean isLeadership,
        boolean isAcknowledgment,
        boolean expressesDoubt
) {
    public boolean containsRiskWord() {
        return !riskKeywords.isEmpty();
    }

    public boolean isDismissive() {
        return !dismissivePatterns.isEmpty();
    }
}
