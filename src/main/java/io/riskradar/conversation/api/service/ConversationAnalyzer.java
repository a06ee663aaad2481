package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.CommunicationGap;
import io.riskradar.conversation.api.dto.ConversationStats;
import io.riskradar.conversation.api.dto.DismissalReport;
import io.riskradar.conversation.api.dto.FlaggedMessage;
import io.riskradar.conversation.api.dto.RiskTheme;
import io.riskradar.conversation.api.dto.ScoredMessage;
import io.riskradar.conversation.api.dto.SentimentPoint;
import io.riskradar.conversation.api.dto.SeverityAssessment;
import io.riskradar.conversation.api.dto.SeverityLevel;
import io.riskradar.conversation.api.util.PhraseMatcher;
import io.riskradar.conversation.config.RiskDetectionConfig;
import io.riskradar.conversation.config.SeverityConfig;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Whole-transcript statistics and the overall risk severity.
 */
@Service
public class ConversationAnalyzer {

    private static final int MAX_FACTOR = 10;
    private static final int IMPACT_BASELINE = 2;

    private final SeverityConfig severity;
    private final PhraseMatcher highImpact;
    private final PhraseMatcher mediumImpact;
    private final PhraseMatcher lowImpact;
    private final Map<String, PhraseMatcher> themes;

    public ConversationAnalyzer(RiskDetectionConfig config) {
        this.severity = config.severity();
        this.highImpact = PhraseMatcher.of(severity.highImpactKeywords());
        this.mediumImpact = PhraseMatcher.of(severity.mediumImpactKeywords());
        this.lowImpact = PhraseMatcher.of(severity.lowImpactKeywords());

        Map<String, PhraseMatcher> compiled = new TreeMap<>();
        config.themes().forEach((theme, keywords) -> compiled.put(theme, PhraseMatcher.of(keywords)));
        this.themes = Collections.unmodifiableMap(compiled);
    }

    public ConversationStats summarize(List<ScoredMessage> scored,
                                       DismissalReport report,
                                       List<CommunicationGap> gaps) {
        int total = scored.size();
        List<FlaggedMessage> flagged = report.flaggedMessages();

        int riskCount = (int) scored.stream().filter(ScoredMessage::containsRiskWord).count();
        int flaggedCount = flagged.size();
        double flagRate = total == 0 ? 0.0 : (double) flaggedCount / total;

        Instant first = scored.stream().map(ScoredMessage::timestamp).min(Instant::compareTo).orElse(null);
        Instant last = scored.stream().map(ScoredMessage::timestamp).max(Instant::compareTo).orElse(null);

        return new ConversationStats(
                total,
                countBy(scored, ScoredMessage::sender),
                countBy(scored, message -> message.message().channel()),
                round(scored.stream().mapToDouble(ScoredMessage::compoundSentiment).average().orElse(0.0)),
                first,
                last,
                first == null ? 0L : Duration.between(first, last).getSeconds(),
                riskCount,
                (int) scored.stream().filter(ScoredMessage::isDismissive).count(),
                (int) scored.stream().filter(ScoredMessage::isLeadership).count(),
                flaggedCount,
                round(flagRate),
                report.clusters().size(),
                gaps.size(),
                scored.stream()
                        .map(message -> new SentimentPoint(message.timestamp(), message.compoundSentiment()))
                        .toList(),
                riskThemes(flagged),
                assessSeverity(report, riskCount, flagRate)
        );
    }

    /**
     * Three 0-10 factors: how many risk messages were later dismissed, how many clusters
     * hold repeated unanswered concerns, and how strongly flagged messages speak of impact.
     * The level is the higher of the factor-average level and the flag-rate level.
     */
    SeverityAssessment assessSeverity(DismissalReport report, int riskCount, double flagRate) {
        int dismissalFactor = riskCount == 0 ? 0
                : scaled((double) report.dismissedConcernCount() / riskCount);
        int persistenceFactor = report.clusters().isEmpty() ? 0
                : scaled((double) report.persistentClusterCount() / report.clusters().size());
        int impactPotential = impactPotential(report.flaggedMessages());

        double composite = round((dismissalFactor + persistenceFactor + impactPotential) / 3.0);
        SeverityLevel compositeLevel = composite >= severity.highScore() ? SeverityLevel.HIGH
                : composite >= severity.mediumScore() ? SeverityLevel.MEDIUM
                : SeverityLevel.LOW;
        SeverityLevel flagRateLevel = flagRateLevel(flagRate);

        return new SeverityAssessment(
                compositeLevel.max(flagRateLevel),
                flagRateLevel,
                dismissalFactor,
                persistenceFactor,
                impactPotential,
                composite
        );
    }

    SeverityLevel flagRateLevel(double flagRate) {
        if (flagRate < severity.lowFlagRate()) return SeverityLevel.LOW;
        if (flagRate > severity.highFlagRate()) return SeverityLevel.HIGH;
        return SeverityLevel.MEDIUM;
    }

    private int impactPotential(List<FlaggedMessage> flagged) {
        if (flagged.isEmpty()) return 0;

        long high = flagged.stream().filter(message -> highImpact.matchesAny(message.message())).count();
        long medium = flagged.stream().filter(message -> mediumImpact.matchesAny(message.message())).count();
        long low = flagged.stream().filter(message -> lowImpact.matchesAny(message.message())).count();

        return (int) Math.min(MAX_FACTOR, high * 3 + medium * 2 + low + IMPACT_BASELINE);
    }

    private List<RiskTheme> riskThemes(List<FlaggedMessage> flagged) {
        List<RiskTheme> found = new ArrayList<>();
        themes.forEach((theme, matcher) -> {
            int mentions = (int) flagged.stream().filter(message -> matcher.matchesAny(message.message())).count();
            if (mentions > 0) {
                found.add(new RiskTheme(theme, mentions));
            }
        });
        found.sort(Comparator.comparingInt(RiskTheme::mentions).reversed().thenComparing(RiskTheme::theme));
        return List.copyOf(found);
    }

    private static Map<String, Long> countBy(List<ScoredMessage> scored, Function<ScoredMessage, String> key) {
        return Collections.unmodifiableMap(scored.stream()
                .collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting())));
    }

    private static int scaled(double fraction) {
        return (int) Math.min(MAX_FACTOR, Math.round(fraction * MAX_FACTOR));
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
