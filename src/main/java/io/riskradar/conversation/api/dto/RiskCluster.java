package io.riskradar.conversation.api.dto;

import java.util.List;

/**
 * A group of topically related risk messages.
 *
 * @param memberIndices risk-keyword messages in the group, in timestamp order
 * @param responseIndices replies attached to the group that carry no risk keyword themselves
 */
public record RiskCluster(
        int id,
        List<Integer> memberIndices,
        List<Integer> responseIndices
) {
    public RiskCluster {
        memberIndices = List.copyOf(memberIndices);
        responseIndices = List.copyOf(responseIndices);
    }

    public RiskCluster withResponses(List<Integer> responses) {
        return new RiskCluster(id, memberIndices, responses);
    }

    public int size() {
        return memberIndices.size();
    }
}
