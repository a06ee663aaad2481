package io.riskradar.conversation.api.dto;

public enum SentimentBand {
    POSITIVE,
    NEUTRAL,
    NEGATIVE
}
