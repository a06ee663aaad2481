package io.riskradar.conversation.api.dto;

import java.util.List;

public record TranscriptRequest(
        List<TranscriptRecord> messages
) {}
