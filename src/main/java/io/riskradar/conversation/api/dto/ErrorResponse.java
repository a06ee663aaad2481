package io.riskradar.conversation.api.dto;

import io.riskradar.conversation.api.exception.ErrorCategory;

public record ErrorResponse(
        String error,
        ErrorCategory category,
        Integer recordIndex
) {}
