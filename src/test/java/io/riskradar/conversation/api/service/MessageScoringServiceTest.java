package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.Message;
import io.riskradar.conversation.api.dto.ScoredMessage;
import io.riskradar.conversation.api.exception.ErrorCategory;
import io.riskradar.conversation.api.exception.RiskAnalysisException;
import io.riskradar.conversation.config.ProcessingConfig;
import io.riskradar.conversation.config.RiskDetectionConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.riskradar.conversation.api.service.TestMessages.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MessageScoringServiceTest {

    @Mock
    private RiskFlagger mockFlagger;

    @Mock
    private ExecutorService mockExecutor;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static RiskDetectionConfig parallel(int threads, int minBatch, Duration timeout) {
        return RiskDetectionConfig.defaults()
                .withProcessing(new ProcessingConfig(threads, minBatch, timeout, false));
    }

    private static List<Message> transcript(int size) {
        List<Message> messages = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            String text = i % 3 == 0 ? "Seeing a glitch on node " + i : "All good on node " + i;
            messages.add(at(i, i % 2 == 0 ? "eng" : "PM_Lead", text));
        }
        return messages;
    }

    @Test
    @DisplayName("Should score in parallel and keep input order")
    void shouldScoreInParallelAndKeepOrder() {
        RiskDetectionConfig config = parallel(4, 2, null);
        List<Message> messages = transcript(50);
        MessageScoringService service = new MessageScoringService(TestMessages.flagger(config), executor, config);

        List<ScoredMessage> scored = service.scoreAll(messages);

        assertThat(scored).hasSize(50);
        for (int i = 0; i < scored.size(); i++) {
            assertThat(scored.get(i).index()).isEqualTo(i);
            assertThat(scored.get(i).message()).isEqualTo(messages.get(i));
        }
    }

    @Test
    @DisplayName("Should produce the same scores sequentially and in parallel")
    void shouldMatchSequentialScores() {
        List<Message> messages = transcript(40);
        RiskDetectionConfig parallelConfig = parallel(4, 2, null);
        RiskDetectionConfig sequentialConfig = parallel(1, 2, null);
        RiskFlagger flagger = TestMessages.flagger(parallelConfig);

        List<ScoredMessage> inParallel = new MessageScoringService(flagger, executor, parallelConfig).scoreAll(messages);
        List<ScoredMessage> sequential = new MessageScoringService(flagger, executor, sequentialConfig).scoreAll(messages);

        assertThat(inParallel).isEqualTo(sequential);
    }

    @Test
    @DisplayName("Should score small batches on the calling thread")
    void shouldScoreSmallBatchesOnCallingThread() {
        RiskDetectionConfig config = parallel(4, 256, null);
        MessageScoringService service = new MessageScoringService(TestMessages.flagger(config), mockExecutor, config);

        assertThat(service.scoreAll(transcript(10))).hasSize(10);
        assertThat(service.scoreAll(List.of())).isEmpty();
        verifyNoInteractions(mockExecutor);
    }

    @Test
    @DisplayName("Should report a timeout when workers exceed the scoring budget")
    void shouldReportScoringTimeout() {
        RiskDetectionConfig config = parallel(2, 2, Duration.ofMillis(50));
        when(mockFlagger.score(anyInt(), any(Message.class))).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return null;
        });
        MessageScoringService service = new MessageScoringService(mockFlagger, executor, config);

        assertThatThrownBy(() -> service.scoreAll(transcript(4)))
                .isInstanceOfSatisfying(RiskAnalysisException.class, e ->
                        assertThat(e.getCategory()).isEqualTo(ErrorCategory.SCORING_TIMEOUT));
    }

    @Test
    @DisplayName("Should report a failed worker")
    void shouldReportFailedWorker() {
        RiskDetectionConfig config = parallel(2, 2, null);
        when(mockFlagger.score(anyInt(), any(Message.class))).thenThrow(new IllegalStateException("boom"));
        MessageScoringService service = new MessageScoringService(mockFlagger, executor, config);

        assertThatThrownBy(() -> service.scoreAll(transcript(4)))
                .isInstanceOfSatisfying(RiskAnalysisException.class, e -> {
                    assertThat(e.getCategory()).isEqualTo(ErrorCategory.SCORING_FAILED);
                    assertThat(e.getCause()).hasMessage("boom");
                });
    }
}
