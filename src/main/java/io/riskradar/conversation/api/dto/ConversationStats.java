package io.riskradar.conversation.api.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ConversationStats(
        int totalMessages,
        Map<String, Long> messagesPerSender,
        Map<String, Long> messagesPerChannel,
        double meanSentiment,
        Instant firstTimestamp,
        Instant lastTimestamp,
        long durationSeconds,
        int riskKeywordCount,
        int dismissiveCount,
        int leadershipMessageCount,
        int flaggedCount,
        double flagRate,
        int clusterCount,
        int communicationGapCount,
        List<SentimentPoint> sentimentTimeline,
        List<RiskTheme> riskThemes,
        SeverityAssessment severity
) {}
