package io.riskradar.conversation.api.dto;

import java.time.Instant;

public record SentimentPoint(
        Instant timestamp,
        double compoundSentiment
) {}
