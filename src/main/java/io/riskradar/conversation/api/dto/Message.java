package io.riskradar.conversation.api.dto;

import java.time.Instant;

public record Message(
        Instant timestamp,
        String sender,
        String channel,
        String text
) {}
