package io.riskradar.conversation.api.dto;

public enum ReasonCode {
    RISK_AND_DISMISSIVE("Risk mentioned together with dismissive language"),
    RISK_POSITIVE_LEADERSHIP("Leadership framing a risk in positive terms"),
    DISMISSED_IN_CLUSTER("Dismisses a concern raised earlier in the same discussion"),
    PERSISTENT_UNACKNOWLEDGED("Concern repeated without any leadership response"),
    CONTINUED_DOUBT("Continued concern or doubt expressed after initial discussion");

    private final String description;

    ReasonCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
