package io.riskradar.conversation.api.dto;

import java.util.List;

public record AnalysisResult(
        String transcriptId,
        List<FlaggedMessage> flaggedMessages,
        List<RiskCluster> clusters,
        List<CommunicationGap> communicationGaps,
        ConversationStats stats
) {}
