package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.Message;
import io.riskradar.conversation.api.dto.ScoredMessage;
import io.riskradar.conversation.api.exception.ErrorCategory;
import io.riskradar.conversation.api.exception.RiskAnalysisException;
import io.riskradar.conversation.config.ProcessingConfig;
import io.riskradar.conversation.config.RiskDetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Scores every message of a transcript. Large transcripts are split into contiguous chunks
 * scored on the worker pool; results are rejoined in input order.
 */
@Service
public class MessageScoringService {

    private static final Logger logger = LoggerFactory.getLogger(MessageScoringService.class);

    private final RiskFlagger riskFlagger;
    private final ExecutorService executor;
    private final ProcessingConfig processing;

    public MessageScoringService(RiskFlagger riskFlagger,
                                 @Qualifier("scoringExecutor") ExecutorService executor,
                                 RiskDetectionConfig config) {
        this.riskFlagger = riskFlagger;
        this.executor = executor;
        this.processing = config.processing();
    }

    public List<ScoredMessage> scoreAll(List<Message> messages) {
        if (messages.isEmpty()) return List.of();

        int parallelism = processing.parallelism();
        if (parallelism <= 1 || messages.size() < processing.minParallelBatch()) {
            return scoreRange(messages, 0, messages.size());
        }

        int chunkSize = (messages.size() + parallelism - 1) / parallelism;
        List<Callable<List<ScoredMessage>>> tasks = new ArrayList<>();
        for (int start = 0; start < messages.size(); start += chunkSize) {
            int from = start;
            int to = Math.min(messages.size(), start + chunkSize);
            tasks.add(() -> scoreRange(messages, from, to));
        }

        logger.debug("Scoring {} messages in {} chunks of up to {}", messages.size(), tasks.size(), chunkSize);

        try {
            List<Future<List<ScoredMessage>>> futures =
                    executor.invokeAll(tasks, processing.getScoringTimeoutMs(), TimeUnit.MILLISECONDS);

            List<ScoredMessage> scored = new ArrayList<>(messages.size());
            for (Future<List<ScoredMessage>> future : futures) {
                scored.addAll(future.get());
            }
            return List.copyOf(scored);

        } catch (CancellationException e) {
            throw new RiskAnalysisException(
                    "Scoring did not finish within " + processing.scoringTimeout(), e, ErrorCategory.SCORING_TIMEOUT);

        } catch (ExecutionException e) {
            throw new RiskAnalysisException(
                    "Scoring worker failed: " + e.getCause().getMessage(), e.getCause(), ErrorCategory.SCORING_FAILED);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RiskAnalysisException("Interrupted while scoring messages", e, ErrorCategory.INTERRUPTED);
        }
    }

    private List<ScoredMessage> scoreRange(List<Message> messages, int from, int to) {
        List<ScoredMessage> scored = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            scored.add(riskFlagger.score(i, messages.get(i)));
        }
        return scored;
    }
}
