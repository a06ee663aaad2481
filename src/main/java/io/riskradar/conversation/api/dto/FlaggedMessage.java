package io.riskradar.conversation.api.dto;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public record FlaggedMessage(
        int index,
        Instant timestamp,
        String sender,
        String channel,
        String message,
        Set<ReasonCode> reasons,
        Integer clusterId
) {
    public FlaggedMessage {
        reasons = Collections.unmodifiableSet(EnumSet.copyOf(reasons));
    }

    public static FlaggedMessage of(ScoredMessage scored, Set<ReasonCode> reasons, Integer clusterId) {
        Message message = scored.message();
        return new FlaggedMessage(
                scored.index(),
                message.timestamp(),
                message.sender(),
                message.channel(),
                message.text(),
                reasons,
                clusterId
        );
    }

    public boolean hasReason(ReasonCode reason) {
        return reasons.contains(reason);
    }
}
