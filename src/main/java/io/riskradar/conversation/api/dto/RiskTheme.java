package io.riskradar.conversation.api.dto;

public record RiskTheme(
        String theme,
        int mentions
) {}
