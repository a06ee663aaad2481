package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.SentimentBand;
import io.riskradar.conversation.config.RiskDetectionConfig;
import io.riskradar.conversation.config.SentimentConfig;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based polarity scoring. Each lexicon hit contributes its valence, adjusted for a
 * preceding booster or dampener, for negation earlier in the same clause and for a
 * contrastive "but"; the sum is squashed into a compound score in [-1, 1].
 */
@Service
public class SentimentScorer {

    private static final Pattern TOKEN = Pattern.compile("([\\p{L}\\p{N}]+(?:['’]\\p{L}+)*)|([,;:.!?])");

    private static final Set<String> NEGATORS = Set.of(
            "not", "no", "never", "none", "nobody", "nothing", "neither", "nor", "nowhere",
            "cannot", "without", "aint", "dont", "cant", "wont", "isnt", "wasnt"
    );
    private static final Set<String> BOOSTERS = Set.of(
            "very", "really", "extremely", "super", "totally", "absolutely", "completely",
            "highly", "incredibly", "hugely", "so", "most", "especially"
    );
    private static final Set<String> DAMPENERS = Set.of(
            "slightly", "somewhat", "barely", "hardly", "marginally", "partly", "scarcely", "kinda"
    );

    private static final double MODIFIER_STEP = 0.293;
    private static final double NEGATION_SCALAR = -0.74;
    private static final double BEFORE_BUT = 0.5;
    private static final double AFTER_BUT = 1.5;
    private static final double EXCLAMATION_STEP = 0.292;
    private static final int MAX_EXCLAMATIONS = 4;
    private static final double NORMALIZATION_ALPHA = 15.0;
    private static final int NEGATION_SCOPE = 3;

    private final SentimentLexicon lexicon;
    private final SentimentConfig sentimentConfig;

    public SentimentScorer(RiskDetectionConfig config) {
        this.sentimentConfig = config.sentiment();
        this.lexicon = SentimentLexicon.load(sentimentConfig.lexiconResource(), sentimentConfig.valenceOverrides());
    }

    public double score(String text) {
        if (text == null || text.isBlank()) return 0.0;

        Tokens tokens = tokenize(text);
        List<Token> words = tokens.words();

        double sum = 0.0;
        int i = 0;
        while (i < words.size()) {
            Hit hit = lookup(words, i);
            if (hit == null) {
                i++;
                continue;
            }

            double valence = applyModifier(words, i, hit.valence());
            if (isNegated(words, i)) {
                valence *= NEGATION_SCALAR;
            }
            if (tokens.butPosition() >= 0) {
                valence *= i < tokens.butPosition() ? BEFORE_BUT : AFTER_BUT;
            }

            sum += valence;
            i += hit.length();
        }

        if (sum != 0.0) {
            int exclamations = (int) Math.min(MAX_EXCLAMATIONS, text.chars().filter(c -> c == '!').count());
            sum += Math.signum(sum) * exclamations * EXCLAMATION_STEP;
        }

        return compound(sum);
    }

    public SentimentBand band(double compound) {
        if (compound > sentimentConfig.positiveCutoff()) return SentimentBand.POSITIVE;
        if (compound < sentimentConfig.negativeCutoff()) return SentimentBand.NEGATIVE;
        return SentimentBand.NEUTRAL;
    }

    private Hit lookup(List<Token> words, int start) {
        Token first = words.get(start);

        for (SentimentLexicon.Phrase phrase : lexicon.phrasesStartingWith(first.word())) {
            if (phraseMatches(words, start, phrase.words())) {
                return new Hit(phrase.valence(), phrase.words().size());
            }
        }

        Double valence = lexicon.valenceOf(first.word());
        return valence != null ? new Hit(valence, 1) : null;
    }

    private boolean phraseMatches(List<Token> words, int start, List<String> phrase) {
        if (start + phrase.size() > words.size()) return false;

        int clause = words.get(start).clause();
        for (int k = 0; k < phrase.size(); k++) {
            Token token = words.get(start + k);
            if (token.clause() != clause || !token.word().equals(phrase.get(k))) {
                return false;
            }
        }
        return true;
    }

    private double applyModifier(List<Token> words, int i, double valence) {
        if (i == 0 || words.get(i - 1).clause() != words.get(i).clause()) return valence;

        String previous = words.get(i - 1).word();
        if (BOOSTERS.contains(previous)) {
            return valence + Math.signum(valence) * MODIFIER_STEP;
        }
        if (DAMPENERS.contains(previous)) {
            return valence - Math.signum(valence) * MODIFIER_STEP;
        }
        return valence;
    }

    private boolean isNegated(List<Token> words, int i) {
        int clause = words.get(i).clause();
        for (int k = Math.max(0, i - NEGATION_SCOPE); k < i; k++) {
            Token token = words.get(k);
            if (token.clause() == clause && isNegator(token.word())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isNegator(String word) {
        return NEGATORS.contains(word) || word.endsWith("n't");
    }

    private static double compound(double sum) {
        if (sum == 0.0) return 0.0;

        double normalized = sum / Math.sqrt(sum * sum + NORMALIZATION_ALPHA);
        double clamped = Math.max(-1.0, Math.min(1.0, normalized));
        return BigDecimal.valueOf(clamped).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }

    private static Tokens tokenize(String text) {
        List<Token> words = new ArrayList<>();
        int clause = 0;
        int butPosition = -1;

        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            if (matcher.group(2) != null) {
                clause++;
                continue;
            }

            String word = matcher.group(1).toLowerCase(Locale.ROOT).replace('’', '\'');
            if (word.equals("but")) {
                if (butPosition < 0) butPosition = words.size();
                clause++;
                continue;
            }
            words.add(new Token(word, clause));
        }
        return new Tokens(words, butPosition);
    }

    private record Token(String word, int clause) {}

    private record Tokens(List<Token> words, int butPosition) {}

    private record Hit(double valence, int length) {}
}
