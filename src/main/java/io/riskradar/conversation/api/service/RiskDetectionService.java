package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.AnalysisResult;
import io.riskradar.conversation.api.dto.CommunicationGap;
import io.riskradar.conversation.api.dto.ConversationStats;
import io.riskradar.conversation.api.dto.DismissalReport;
import io.riskradar.conversation.api.dto.Message;
import io.riskradar.conversation.api.dto.RiskCluster;
import io.riskradar.conversation.api.dto.ScoredMessage;
import io.riskradar.conversation.api.dto.SeverityLevel;
import io.riskradar.conversation.config.RiskDetectionConfig;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class RiskDetectionService {
    private static final Logger logger = LoggerFactory.getLogger(RiskDetectionService.class);

    private final MessageScoringService scoringService;
    private final SimilarityClusterer clusterer;
    private final DismissalAnalyzer dismissalAnalyzer;
    private final CommunicationGapDetector gapDetector;
    private final ConversationAnalyzer conversationAnalyzer;
    private final EventPublisherService eventPublisher;
    private final RiskDetectionConfig config;

    public RiskDetectionService(MessageScoringService scoringService,
                                SimilarityClusterer clusterer,
                                DismissalAnalyzer dismissalAnalyzer,
                                CommunicationGapDetector gapDetector,
                                ConversationAnalyzer conversationAnalyzer,
                                EventPublisherService eventPublisher,
                                RiskDetectionConfig config) {
        this.scoringService = scoringService;
        this.clusterer = clusterer;
        this.dismissalAnalyzer = dismissalAnalyzer;
        this.gapDetector = gapDetector;
        this.conversationAnalyzer = conversationAnalyzer;
        this.eventPublisher = eventPublisher;
        this.config = config;
    }

    public AnalysisResult analyze(List<Message> messages) {
        long startTime = System.currentTimeMillis();

        List<Message> ordered = new ArrayList<>(messages);
        ordered.sort(Comparator.comparing(Message::timestamp));
        String transcriptId = fingerprint(ordered);

        logger.info("Starting risk analysis of transcript {} ({} messages)", transcriptId, ordered.size());

        List<ScoredMessage> scored = scoringService.scoreAll(ordered);
        List<RiskCluster> clusters = clusterer.cluster(scored);
        DismissalReport report = dismissalAnalyzer.analyze(scored, clusters);
        List<CommunicationGap> gaps = gapDetector.detect(scored);
        ConversationStats stats = conversationAnalyzer.summarize(scored, report, gaps);

        AnalysisResult result = new AnalysisResult(
                transcriptId,
                report.flaggedMessages(),
                report.clusters(),
                gaps,
                stats
        );

        long duration = System.currentTimeMillis() - startTime;
        logger.info("Risk analysis of {} completed: {} flagged, {} clusters, {} gaps, severity {} in {}ms",
                transcriptId, stats.flaggedCount(), stats.clusterCount(), stats.communicationGapCount(),
                stats.severity().level(), duration);

        if (config.processing().publishEvents()) {
            eventPublisher.publishConversationAnalyzed(result);

            if (stats.severity().level() == SeverityLevel.HIGH) {
                eventPublisher.publishHighRiskDetected(result);
            }
        }

        return result;
    }

    /**
     * Content hash of the ordered transcript, stable across runs over the same input.
     */
    static String fingerprint(List<Message> ordered) {
        StringBuilder canonical = new StringBuilder();
        for (Message message : ordered) {
            canonical.append(message.timestamp()).append('\u001f')
                    .append(message.sender()).append('\u001f')
                    .append(message.channel()).append('\u001f')
                    .append(message.text()).append('\u001e');
        }
        return "CONV-" + DigestUtils.sha256Hex(canonical.toString()).substring(0, 16);
    }
}
