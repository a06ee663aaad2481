package io.riskradar.conversation.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * A message together with everything derived from its text and sender.
 *
 * @param index position of the message in the timestamp-ordered transcript
 */
public record ScoredMessage(
        int index,
        Message message,
        double compoundSentiment,
        SentimentBand sentimentBand,
        boolean containsRiskWord,
        boolean isDismissive,
        boolean isLeadership,
        boolean isAcknowledgment,
        boolean expressesDoubt,
        boolean isDownplaying,
        List<String> matchedRiskKeywords,
        List<String> matchedDismissivePatterns
) {
    public Instant timestamp() {
        return message.timestamp();
    }

    public String sender() {
        return message.sender();
    }

    public String text() {
        return message.text();
    }
}
