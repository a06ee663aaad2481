package io.riskradar.conversation.api.dto;

/**
 * A transcript row as received, before timestamp parsing and field validation.
 */
public record TranscriptRecord(
        String timestamp,
        String sender,
        String channel,
        String message
) {}
