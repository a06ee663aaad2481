package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.AnalysisResult;
import io.riskradar.conversation.api.dto.kafka.ConversationAnalyzedEvent;
import io.riskradar.conversation.api.dto.kafka.HighRiskConversationEvent;
import io.riskradar.conversation.config.KafkaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties kafkaProperties;

    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties kafkaProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaProperties = kafkaProperties;
    }

    public void publishConversationAnalyzed(AnalysisResult result) {
        attempts.incrementAndGet();
        try {
            ConversationAnalyzedEvent event = ConversationAnalyzedEvent.create(result);
            String topic = kafkaProperties.conversationAnalyzed();

            send(topic, result.transcriptId(), event).whenComplete((sent, ex) -> {
                if (ex == null) {
                    logger.debug("Sent conversation analyzed event: {} to {}", result.transcriptId(), topic);
                } else {
                    logger.error("Failed to send conversation analyzed event: {}", result.transcriptId(), ex);
                }
            });

        } catch (Exception e) {
            failed.incrementAndGet();
            logger.error("Error publishing conversation analyzed event for transcript: {}", result.transcriptId(), e);
        }
    }

    public void publishHighRiskDetected(AnalysisResult result) {
        attempts.incrementAndGet();
        try {
            HighRiskConversationEvent event = HighRiskConversationEvent.create(result);
            String topic = kafkaProperties.highRiskDetected();

            send(topic, event.alertId(), event).whenComplete((sent, ex) -> {
                if (ex == null) {
                    logger.warn("ALERT SENT: High risk event {} for transcript: {} ({} flagged messages)",
                            event.alertId(), result.transcriptId(), event.flaggedCount());
                } else {
                    logger.error("CRITICAL: Failed to send high risk alert: {}", event.alertId(), ex);
                }
            });

        } catch (Exception e) {
            failed.incrementAndGet();
            logger.error("Error publishing high risk event for transcript: {}", result.transcriptId(), e);
        }
    }

    public boolean isHealthy() {
        return getStats().getFailureRate() < 0.5;
    }

    public PublishingStats getStats() {
        return new PublishingStats(published.get(), failed.get(), attempts.get());
    }

    private CompletableFuture<SendResult<String, Object>> send(String topic, String key, Object event) {
        return kafkaTemplate.send(topic, key, event).whenComplete((sent, ex) -> {
            if (ex == null) {
                published.incrementAndGet();
            } else {
                failed.incrementAndGet();
            }
        });
    }

    public record PublishingStats(
            long totalPublished,
            long totalFailed,
            long totalAttempts
    ) {
        public double getSuccessRate() {
            return totalAttempts > 0 ? (double) totalPublished / totalAttempts : 0.0;
        }

        public double getFailureRate() {
            return totalAttempts > 0 ? (double) totalFailed / totalAttempts : 0.0;
        }
    }
}
