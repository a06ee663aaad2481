package io.riskradar.conversation.api.exception;

public enum ErrorCategory {
    MALFORMED_TIMESTAMP,  // Timestamp present but unparseable
    MISSING_FIELD,        // timestamp, sender, channel or message absent
    SCORING_TIMEOUT,      // Parallel scoring exceeded its time budget
    SCORING_FAILED,       // A scoring worker failed
    INTERRUPTED           // Caller thread interrupted while waiting on workers
}
