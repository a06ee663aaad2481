package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.CommunicationGap;
import io.riskradar.conversation.api.dto.ScoredMessage;
import io.riskradar.conversation.config.GapConfig;
import io.riskradar.conversation.config.RiskDetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Splits the transcript into fixed, non-overlapping windows and reports the windows where
 * non-leadership senders raised a risk and leadership gave no non-dismissive reply, either
 * in the same window or in the configured number of following windows.
 */
@Service
public class CommunicationGapDetector {

    private static final Logger logger = LoggerFactory.getLogger(CommunicationGapDetector.class);

    private final GapConfig gaps;

    public CommunicationGapDetector(RiskDetectionConfig config) {
        this.gaps = config.gaps();
    }

    public List<CommunicationGap> detect(List<ScoredMessage> scored) {
        if (scored.isEmpty()) return List.of();

        Instant origin = windowOrigin(scored);
        long widthMs = gaps.windowWidth().toMillis();

        TreeMap<Long, List<ScoredMessage>> windows = new TreeMap<>();
        for (ScoredMessage message : scored) {
            long key = Math.floorDiv(Duration.between(origin, message.timestamp()).toMillis(), widthMs);
            windows.computeIfAbsent(key, k -> new ArrayList<>()).add(message);
        }

        List<CommunicationGap> detected = new ArrayList<>();
        for (Map.Entry<Long, List<ScoredMessage>> window : windows.entrySet()) {
            List<ScoredMessage> concerns = window.getValue().stream()
                    .filter(message -> message.containsRiskWord() && !message.isLeadership())
                    .toList();
            if (concerns.isEmpty()) continue;

            List<ScoredMessage> responses = windows
                    .subMap(window.getKey(), true, window.getKey() + gaps.graceWindows(), true)
                    .values().stream()
                    .flatMap(List::stream)
                    .filter(ScoredMessage::isLeadership)
                    .toList();

            boolean adequatelyAnswered = responses.stream().anyMatch(response -> !response.isDismissive());
            if (adequatelyAnswered) continue;

            Instant start = origin.plusMillis(window.getKey() * widthMs);
            Set<String> senders = new TreeSet<>();
            concerns.forEach(concern -> senders.add(concern.sender()));

            detected.add(new CommunicationGap(
                    start,
                    start.plusMillis(widthMs),
                    Collections.unmodifiableSet(senders),
                    concerns.stream().map(ScoredMessage::index).toList(),
                    responses.stream().map(ScoredMessage::index).toList(),
                    !responses.isEmpty()
            ));
        }

        logger.debug("Found {} communication gaps across {} windows of {}", detected.size(), windows.size(),
                gaps.windowWidth());
        return List.copyOf(detected);
    }

    private Instant windowOrigin(List<ScoredMessage> scored) {
        return switch (gaps.alignment()) {
            case FIRST_MESSAGE -> scored.stream()
                    .map(ScoredMessage::timestamp)
                    .min(Instant::compareTo)
                    .orElseThrow();
            case WALL_CLOCK -> Instant.EPOCH;
        };
    }
}
