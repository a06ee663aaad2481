package io.riskradar.conversation.api.dto;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * A time window in which non-leadership concerns got no adequate leadership reply.
 *
 * @param windowEnd exclusive
 * @param leadershipResponded true when leadership did write in the window, but only dismissively
 */
public record CommunicationGap(
        Instant windowStart,
        Instant windowEnd,
        Set<String> concernedSenders,
        List<Integer> concernIndices,
        List<Integer> responseIndices,
        boolean leadershipResponded
) {}
