package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.KeywordMatch;
import io.riskradar.conversation.api.util.PhraseMatcher;
import io.riskradar.conversation.config.LexiconConfig;
import io.riskradar.conversation.config.RiskDetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;

@Service
public class KeywordMatcher {

    private static final Logger logger = LoggerFactory.getLogger(KeywordMatcher.class);

    private final PhraseMatcher riskKeywords;
    private final PhraseMatcher dismissivePatterns;
    private final PhraseMatcher acknowledgmentPatterns;
    private final PhraseMatcher doubtPatterns;
    private final Set<String> leadershipRoles;

    public KeywordMatcher(RiskDetectionConfig config) {
        LexiconConfig lexicon = config.lexicon();

        this.riskKeywords = PhraseMatcher.of(lexicon.riskKeywords());
        this.dismissivePatterns = PhraseMatcher.of(lexicon.dismissivePatterns());
        this.acknowledgmentPatterns = PhraseMatcher.of(lexicon.acknowledgmentPatterns());
        this.doubtPatterns = PhraseMatcher.of(lexicon.doubtPatterns());
        this.leadershipRoles = lexicon.leadershipRoles();

        logger.debug("Keyword matcher ready: {} risk keywords, {} dismissive patterns, {} leadership roles",
                riskKeywords.size(), dismissivePatterns.size(), leadershipRoles.size());
    }

    public KeywordMatch match(String text, String sender) {
        return new KeywordMatch(
                riskKeywords.findAll(text),
                dismissivePatterns.findAll(text),
                isLeadership(sender),
                acknowledgmentPatterns.matchesAny(text),
                doubtPatterns.matchesAny(text)
        );
    }

    public boolean containsRiskWord(String text) {
        return riskKeywords.matchesAny(text);
    }

    public boolean isDismissive(String text) {
        return dismissivePatterns.matchesAny(text);
    }

    public boolean isLeadership(String sender) {
        return sender != null && leadershipRoles.contains(sender);
    }
}
