package io.riskradar.conversation.api.dto;

import java.util.List;

public record DismissalReport(
        List<RiskCluster> clusters,
        List<ClusterFindings> findings,
        List<FlaggedMessage> flaggedMessages
) {
    public static DismissalReport empty() {
        return new DismissalReport(List.of(), List.of(), List.of());
    }

    public int dismissedConcernCount() {
        return findings.stream()
                .mapToInt(finding -> finding.dismissedConcernIndices().size())
                .sum();
    }

    public long persistentClusterCount() {
        return findings.stream()
                .filter(ClusterFindings::persistent)
                .count();
    }
}
