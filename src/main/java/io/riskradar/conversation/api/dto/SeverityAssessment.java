package io.riskradar.conversation.api.dto;

/**
 * Factors are on a 0-10 scale.
 */
public record SeverityAssessment(
        SeverityLevel level,
        SeverityLevel flagRateLevel,
        int dismissalFactor,
        int persistenceFactor,
        int impactPotential,
        double compositeScore
) {}
