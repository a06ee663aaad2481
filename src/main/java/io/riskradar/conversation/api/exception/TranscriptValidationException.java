package io.riskradar.conversation.api.exception;

/**
 * Raised when a transcript record violates the input contract. The whole batch is rejected.
 */
public class TranscriptValidationException extends Exception {
    private final ErrorCategory category;
    private final int recordIndex;

    public TranscriptValidationException(String message, ErrorCategory category, int recordIndex) {
        super(message);
        this.category = category;
        this.recordIndex = recordIndex;
    }

    public TranscriptValidationException(String message, Throwable cause, ErrorCategory category, int recordIndex) {
        super(message, cause);
        this.category = category;
        this.recordIndex = recordIndex;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public int getRecordIndex() {
        return recordIndex;
    }
}
