package io.riskradar.conversation.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.riskradar.conversation.api.dto.AnalysisResult;
import io.riskradar.conversation.api.dto.FlaggedMessage;
import io.riskradar.conversation.api.dto.SeverityAssessment;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

public record HighRiskConversationEvent(
        @JsonProperty("alertId") String alertId,
        @JsonProperty("transcriptId") String transcriptId,
        @JsonProperty("flaggedCount") int flaggedCount,
        @JsonProperty("dismissalFactor") int dismissalFactor,
        @JsonProperty("persistenceFactor") int persistenceFactor,
        @JsonProperty("impactPotential") int impactPotential,
        @JsonProperty("involvedSenders") Set<String> involvedSenders,
        @JsonProperty("detectedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime detectedAt
) {
    public static HighRiskConversationEvent create(AnalysisResult result) {
        SeverityAssessment severity = result.stats().severity();
        Set<String> senders = new TreeSet<>();
        result.flaggedMessages().stream().map(FlaggedMessage::sender).forEach(senders::add);

        return new HighRiskConversationEvent(
                "ALERT-" + UUID.randomUUID().toString().substring(0, 8),
                result.transcriptId(),
                result.flaggedMessages().size(),
                severity.dismissalFactor(),
                severity.persistenceFactor(),
                severity.impactPotential(),
                senders,
                LocalDateTime.now()
        );
    }
}
