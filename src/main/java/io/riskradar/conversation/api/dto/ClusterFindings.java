package io.riskradar.conversation.api.dto;

import java.util.List;

public record ClusterFindings(
        int clusterId,
        int concernCount,
        List<Integer> dismissedConcernIndices,
        boolean persistent
) {}
