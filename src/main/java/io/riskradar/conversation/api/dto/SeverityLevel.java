package io.riskradar.conversation.api.dto;

public enum SeverityLevel {
    LOW,
    MEDIUM,
    HIGH;

    public SeverityLevel max(SeverityLevel other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
