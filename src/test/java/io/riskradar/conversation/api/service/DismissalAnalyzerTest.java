package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.DismissalReport;
import io.riskradar.conversation.api.dto.FlaggedMessage;
import io.riskradar.conversation.api.dto.Message;
import io.riskradar.conversation.api.dto.ReasonCode;
import io.riskradar.conversation.api.dto.ScoredMessage;
import io.riskradar.conversation.config.RiskDetectionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.riskradar.conversation.api.service.TestMessages.at;
import static org.assertj.core.api.Assertions.assertThat;

class DismissalAnalyzerTest {

    private RiskFlagger flagger;
    private SimilarityClusterer clusterer;
    private DismissalAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        RiskDetectionConfig config = RiskDetectionConfig.defaults();
        flagger = TestMessages.flagger(config);
        clusterer = new SimilarityClusterer(config);
        analyzer = new DismissalAnalyzer(flagger, config);
    }

    private DismissalReport analyze(Message... messages) {
        List<ScoredMessage> scored = TestMessages.score(flagger, messages);
        return analyzer.analyze(scored, clusterer.cluster(scored));
    }

    @Test
    @DisplayName("Should tag the dismissive reply to another sender's concern")
    void shouldTagDismissiveReply() {
        DismissalReport report = analyze(TestMessages.thermalScenario().toArray(Message[]::new));

        assertThat(report.flaggedMessages()).hasSize(1);
        FlaggedMessage flagged = report.flaggedMessages().get(0);
        assertThat(flagged.index()).isEqualTo(1);
        assertThat(flagged.sender()).isEqualTo("PM_Lead");
        assertThat(flagged.reasons()).containsExactly(ReasonCode.DISMISSED_IN_CLUSTER);
        assertThat(flagged.clusterId()).isEqualTo(1);

        assertThat(report.clusters()).hasSize(1);
        assertThat(report.clusters().get(0).memberIndices()).containsExactly(0);
        assertThat(report.clusters().get(0).responseIndices()).containsExactly(1);
        assertThat(report.findings().get(0).dismissedConcernIndices()).containsExactly(0);
        assertThat(report.dismissedConcernCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not attach replies that arrive after the response horizon")
    void shouldNotAttachLateReplies() {
        DismissalReport report = analyze(
                at(0, "eng", "We see a thermal deviation, possible anomaly."),
                at(20, "PM_Lead", "Not a big deal, within tolerance."));

        assertThat(report.clusters().get(0).responseIndices()).isEmpty();
        assertThat(report.flaggedMessages()).isEmpty();
    }

    @Test
    @DisplayName("Should not tag a sender dismissing their own concern")
    void shouldNotTagSelfDismissal() {
        DismissalReport report = analyze(
                at(0, "eng", "We see a thermal deviation, possible anomaly."),
                at(1, "eng", "Probably nothing though"));

        assertThat(report.flaggedMessages()).isEmpty();
    }

    @Test
    @DisplayName("Should close a concern once its raiser acknowledges it")
    void shouldCloseAcknowledgedConcern() {
        DismissalReport report = analyze(
                at(0, "eng", "We see a thermal deviation, possible anomaly."),
                at(1, "eng", "False alarm, resolved"),
                at(2, "PM_Lead", "Not a big deal"));

        assertThat(report.clusters().get(0).responseIndices()).containsExactly(1, 2);
        assertThat(report.flaggedMessages()).isEmpty();
    }

    @Test
    @DisplayName("Should flag a concern repeated without a leadership response")
    void shouldFlagPersistentConcern() {
        DismissalReport report = analyze(
                at(0, "eng", "Seeing a thermal deviation on panel A"),
                at(3, "ops", "thermal deviation on panel A again"));

        assertThat(report.flaggedMessages())
                .extracting(FlaggedMessage::index)
                .containsExactly(1);
        assertThat(report.flaggedMessages().get(0).reasons())
                .containsExactly(ReasonCode.PERSISTENT_UNACKNOWLEDGED);
        assertThat(report.persistentClusterCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reset the unanswered count when leadership joins the thread")
    void shouldResetUnansweredCountOnLeadershipResponse() {
        DismissalReport report = analyze(
                at(0, "eng", "Seeing a thermal deviation on panel A"),
                at(1, "PM_Lead", "Looking into the thermal deviation now"),
                at(3, "ops", "thermal deviation on panel A again"));

        assertThat(report.clusters()).hasSize(1);
        assertThat(report.flaggedMessages()).isEmpty();
        assertThat(report.persistentClusterCount()).isZero();
    }

    @Test
    @DisplayName("Should flag doubt expressed after a concern was dismissed")
    void shouldFlagContinuedDoubt() {
        DismissalReport report = analyze(
                at(0, "eng", "We see a thermal deviation, possible anomaly."),
                at(2, "PM_Lead", "Not a big deal, within tolerance."),
                at(4, "eng", "I still think it matters"));

        assertThat(report.flaggedMessages())
                .extracting(FlaggedMessage::index)
                .containsExactly(1, 2);
        assertThat(report.flaggedMessages().get(1).reasons()).containsExactly(ReasonCode.CONTINUED_DOUBT);
        assertThat(report.flaggedMessages().get(1).clusterId()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should flag leadership downplaying even without a neighbouring message")
    void shouldFlagLeadershipDownplayAlone() {
        DismissalReport report = analyze(at(0, "Director", "Minor spike, no criticals, all clear"));

        assertThat(report.flaggedMessages()).hasSize(1);
        assertThat(report.flaggedMessages().get(0).reasons())
                .contains(ReasonCode.RISK_POSITIVE_LEADERSHIP);
        assertThat(report.findings().get(0).concernCount()).isZero();
    }

    @Test
    @DisplayName("Should return an empty report for an empty transcript")
    void shouldReturnEmptyReportForEmptyTranscript() {
        DismissalReport report = analyzer.analyze(List.of(), List.of());

        assertThat(report.clusters()).isEmpty();
        assertThat(report.flaggedMessages()).isEmpty();
        assertThat(report.dismissedConcernCount()).isZero();
    }
}
