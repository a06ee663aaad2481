package io.riskradar.conversation.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.riskradar.conversation.api.dto.AnalysisResult;
import io.riskradar.conversation.api.dto.ConversationStats;
import io.riskradar.conversation.api.dto.SeverityLevel;

import java.time.LocalDateTime;

public record ConversationAnalyzedEvent(
        @JsonProperty("transcriptId") String transcriptId,
        @JsonProperty("totalMessages") int totalMessages,
        @JsonProperty("flaggedCount") int flaggedCount,
        @JsonProperty("flagRate") double flagRate,
        @JsonProperty("clusterCount") int clusterCount,
        @JsonProperty("communicationGapCount") int communicationGapCount,
        @JsonProperty("severity") SeverityLevel severity,
        @JsonProperty("analyzedAt") @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime analyzedAt
) {
    public static ConversationAnalyzedEvent create(AnalysisResult result) {
        ConversationStats stats = result.stats();
        return new ConversationAnalyzedEvent(
                result.transcriptId(),
                stats.totalMessages(),
                stats.flaggedCount(),
                stats.flagRate(),
                stats.clusterCount(),
                stats.communicationGapCount(),
                stats.severity().level(),
                LocalDateTime.now()
        );
    }
}
