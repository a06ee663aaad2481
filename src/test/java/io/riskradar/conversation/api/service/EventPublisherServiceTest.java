package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.AnalysisResult;
import io.riskradar.conversation.api.dto.ConversationStats;
import io.riskradar.conversation.api.dto.FlaggedMessage;
import io.riskradar.conversation.api.dto.ReasonCode;
import io.riskradar.conversation.api.dto.SeverityAssessment;
import io.riskradar.conversation.api.dto.SeverityLevel;
import io.riskradar.conversation.api.dto.kafka.ConversationAnalyzedEvent;
import io.riskradar.conversation.api.dto.kafka.HighRiskConversationEvent;
import io.riskradar.conversation.config.KafkaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventPublisherServiceTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private EventPublisherService service;

    @BeforeEach
    void setUp() {
        var kafkaConfig = new KafkaProperties(
                "test-conversation-analyzed",
                "test-high-risk-detected"
        );

        service = new EventPublisherService(kafkaTemplate, kafkaConfig);
    }

    @Test
    @DisplayName("Should publish analyzed event keyed by transcript id")
    void shouldPublishConversationAnalyzedEvent() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));
        ArgumentCaptor<Object> eventCaptor = ArgumentCaptor.forClass(Object.class);

        service.publishConversationAnalyzed(createResult(SeverityLevel.MEDIUM));

        verify(kafkaTemplate).send(eq("test-conversation-analyzed"), eq("CONV-0123456789abcdef"), eventCaptor.capture());
        ConversationAnalyzedEvent event = (ConversationAnalyzedEvent) eventCaptor.getValue();
        assertThat(event.transcriptId()).isEqualTo("CONV-0123456789abcdef");
        assertThat(event.flaggedCount()).isEqualTo(2);
        assertThat(event.severity()).isEqualTo(SeverityLevel.MEDIUM);
        assertThat(service.getStats().totalPublished()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should publish high risk alert with involved senders")
    void shouldPublishHighRiskEvent() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));
        ArgumentCaptor<String> keyCaptor = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object> eventCaptor = ArgumentCaptor.forClass(Object.class);

        service.publishHighRiskDetected(createResult(SeverityLevel.HIGH));

        verify(kafkaTemplate).send(eq("test-high-risk-detected"), keyCaptor.capture(), eventCaptor.capture());
        HighRiskConversationEvent event = (HighRiskConversationEvent) eventCaptor.getValue();
        assertThat(keyCaptor.getValue()).isEqualTo(event.alertId()).startsWith("ALERT-");
        assertThat(event.involvedSenders()).containsExactly("PM_Lead", "eng");
        assertThat(event.dismissalFactor()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should count failed sends and report unhealthy")
    void shouldCountFailedSends() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        service.publishConversationAnalyzed(createResult(SeverityLevel.LOW));

        assertThat(service.getStats().totalFailed()).isEqualTo(1);
        assertThat(service.getStats().getSuccessRate()).isEqualTo(0.0);
        assertThat(service.isHealthy()).isFalse();
    }

    @Test
    @DisplayName("Should stay healthy while sends are pending")
    void shouldStayHealthyWhileSendsArePending() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        service.publishConversationAnalyzed(createResult(SeverityLevel.LOW));

        assertThat(service.getStats().totalAttempts()).isEqualTo(1);
        assertThat(service.getStats().totalPublished()).isZero();
        assertThat(service.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Should not propagate template errors to the caller")
    void shouldNotPropagateTemplateErrors() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("no producer"));

        service.publishConversationAnalyzed(createResult(SeverityLevel.LOW));

        assertThat(service.getStats().totalFailed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count an attempt when the event cannot be built")
    void shouldCountAttemptWhenEventCannotBeBuilt() {
        AnalysisResult withoutStats = new AnalysisResult("CONV-0123456789abcdef", List.of(), List.of(), List.of(), null);

        service.publishConversationAnalyzed(withoutStats);
        service.publishHighRiskDetected(withoutStats);

        var stats = service.getStats();
        assertThat(stats.totalAttempts()).isEqualTo(2);
        assertThat(stats.totalFailed()).isEqualTo(2);
        assertThat(stats.getFailureRate()).isEqualTo(1.0);
        assertThat(service.isHealthy()).isFalse();
        verify(kafkaTemplate, never()).send(anyString(), anyString(), any());
    }

    private static AnalysisResult createResult(SeverityLevel level) {
        Instant start = Instant.parse("2024-03-01T09:00:00Z");
        List<FlaggedMessage> flagged = List.of(
                new FlaggedMessage(1, start.plusSeconds(120), "PM_Lead", "#ops", "Not a big deal",
                        Set.of(ReasonCode.DISMISSED_IN_CLUSTER), 1),
                new FlaggedMessage(2, start.plusSeconds(240), "eng", "#ops", "I still think it matters",
                        Set.of(ReasonCode.CONTINUED_DOUBT), 1));

        ConversationStats stats = new ConversationStats(
                3, Map.of("eng", 2L, "PM_Lead", 1L), Map.of("#ops", 3L), 0.1, start, start.plusSeconds(240), 240,
                1, 1, 1, 2, 0.6667, 1, 1, List.of(), List.of(),
                new SeverityAssessment(level, SeverityLevel.HIGH, 10, 0, 2, 4.0));

        return new AnalysisResult("CONV-0123456789abcdef", flagged, List.of(), List.of(), stats);
    }
}
