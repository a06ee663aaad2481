package io.riskradar.conversation.api.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PhraseMatcherTest {

    @Test
    @DisplayName("Should match multi-word phrases across any whitespace")
    void shouldMatchPhrasesAcrossWhitespace() {
        PhraseMatcher matcher = PhraseMatcher.of(List.of("not a big deal"));

        assertThat(matcher.matchesAny("honestly not  a\tbig deal")).isTrue();
        assertThat(matcher.matchesAny("not a bigger deal")).isFalse();
    }

    @Test
    @DisplayName("Should match punctuation-only phrases directly after a word")
    void shouldMatchPunctuationPhrasesAfterWord() {
        PhraseMatcher matcher = PhraseMatcher.of(List.of("..."));

        assertThat(matcher.matchesAny("ok...")).isTrue();
        assertThat(matcher.matchesAny("ok.")).isFalse();
    }

    @Test
    @DisplayName("Should ignore blank and duplicate phrases")
    void shouldIgnoreBlankAndDuplicatePhrases() {
        PhraseMatcher matcher = PhraseMatcher.of(Arrays.asList("Spike", "spike", " ", null));

        assertThat(matcher.size()).isEqualTo(1);
        assertThat(matcher.findAll("Spike on line 3")).containsExactly("spike");
    }

    @Test
    @DisplayName("Should find nothing in empty text")
    void shouldFindNothingInEmptyText() {
        PhraseMatcher matcher = PhraseMatcher.of(List.of("spike"));

        assertThat(matcher.findAll(null)).isEmpty();
        assertThat(matcher.matchesAny("")).isFalse();
    }

    @Test
    @DisplayName("Should split text into lowercase word tokens")
    void shouldSplitTextIntoLowercaseTokens() {
        assertThat(TextTokenizer.words("Thermal-deviation, Panel A!")).containsExactly("thermal", "deviation", "panel", "a");
        assertThat(TextTokenizer.words("  ")).isEmpty();
    }
}
