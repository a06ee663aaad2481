package io.riskradar.conversation.api.exception;

public class RiskAnalysisException extends RuntimeException {
    private final ErrorCategory category;

    public RiskAnalysisException(String message, Throwable cause, ErrorCategory category) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
