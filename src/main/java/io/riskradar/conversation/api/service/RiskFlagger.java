package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.KeywordMatch;
import io.riskradar.conversation.api.dto.Message;
import io.riskradar.conversation.api.dto.ReasonCode;
import io.riskradar.conversation.api.dto.ScoredMessage;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-message downplay detection: a risk mentioned with dismissive language, or a risk
 * mentioned by leadership in positive terms.
 */
@Service
public class RiskFlagger {

    private final SentimentScorer sentimentScorer;
    private final KeywordMatcher keywordMatcher;

    public RiskFlagger(SentimentScorer sentimentScorer, KeywordMatcher keywordMatcher) {
        this.sentimentScorer = sentimentScorer;
        this.keywordMatcher = keywordMatcher;
    }

    public ScoredMessage score(int index, Message message) {
        double compound = sentimentScorer.score(message.text());
        KeywordMatch match = keywordMatcher.match(message.text(), message.sender());

        return new ScoredMessage(
                index,
                message,
                compound,
                sentimentScorer.band(compound),
                match.containsRiskWord(),
                match.isDismissive(),
                match.isLeadership(),
                match.isAcknowledgment(),
                match.expressesDoubt(),
                isDownplaying(match.containsRiskWord(), match.isDismissive(), match.isLeadership(), compound),
                match.riskKeywords(),
                match.dismissivePatterns()
        );
    }

    public Set<ReasonCode> downplayReasons(ScoredMessage scored) {
        Set<ReasonCode> reasons = EnumSet.noneOf(ReasonCode.class);
        if (!scored.containsRiskWord()) return reasons;

        if (scored.isDismissive()) {
            reasons.add(ReasonCode.RISK_AND_DISMISSIVE);
        }
        if (scored.isLeadership() && scored.compoundSentiment() > 0) {
            reasons.add(ReasonCode.RISK_POSITIVE_LEADERSHIP);
        }
        return reasons;
    }

    static boolean isDownplaying(boolean containsRiskWord, boolean isDismissive, boolean isLeadership, double compound) {
        return (containsRiskWord && isDismissive)
                || (containsRiskWord && compound > 0 && isLeadership);
    }
}
