package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.ClusterFindings;
import io.riskradar.conversation.api.dto.DismissalReport;
import io.riskradar.conversation.api.dto.FlaggedMessage;
import io.riskradar.conversation.api.dto.ReasonCode;
import io.riskradar.conversation.api.dto.RiskCluster;
import io.riskradar.conversation.api.dto.ScoredMessage;
import io.riskradar.conversation.config.RiskDetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Walks each cluster's timeline in timestamp order looking for concerns that get dismissed
 * or keep coming back without a leadership response, then merges those findings with the
 * per-message downplay flags into the final flagged list.
 *
 * <p>The timeline of a cluster is its members plus the replies attached to it: a message
 * without risk keywords is attached to the cluster of the closest earlier risk message when
 * it follows within the response horizon and is dismissive, from leadership, an
 * acknowledgment or an expression of doubt.</p>
 */
@Service
public class DismissalAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(DismissalAnalyzer.class);

    private final RiskFlagger riskFlagger;
    private final Duration responseHorizon;

    public DismissalAnalyzer(RiskFlagger riskFlagger, RiskDetectionConfig config) {
        this.riskFlagger = riskFlagger;
        this.responseHorizon = config.clustering().responseHorizon();
    }

    public DismissalReport analyze(List<ScoredMessage> scored, List<RiskCluster> clusters) {
        if (scored.isEmpty()) return DismissalReport.empty();

        List<RiskCluster> withResponses = attachResponses(scored, clusters);

        Map<Integer, Set<ReasonCode>> reasons = new TreeMap<>();
        Map<Integer, Integer> clusterOf = new HashMap<>();
        List<ClusterFindings> findings = new ArrayList<>(withResponses.size());

        for (RiskCluster cluster : withResponses) {
            cluster.memberIndices().forEach(index -> clusterOf.put(index, cluster.id()));
            cluster.responseIndices().forEach(index -> clusterOf.put(index, cluster.id()));

            ScanState state = scan(timeline(scored, cluster));
            state.tags.forEach((index, tags) ->
                    reasons.computeIfAbsent(index, key -> EnumSet.noneOf(ReasonCode.class)).addAll(tags));

            findings.add(new ClusterFindings(
                    cluster.id(),
                    state.concernCount,
                    List.copyOf(state.dismissedConcerns),
                    state.persistent
            ));
        }

        for (ScoredMessage message : scored) {
            if (message.isDownplaying()) {
                reasons.computeIfAbsent(message.index(), key -> EnumSet.noneOf(ReasonCode.class))
                        .addAll(riskFlagger.downplayReasons(message));
            }
        }

        List<FlaggedMessage> flagged = reasons.entrySet().stream()
                .filter(entry -> !entry.getValue().isEmpty())
                .map(entry -> FlaggedMessage.of(
                        scored.get(entry.getKey()), entry.getValue(), clusterOf.get(entry.getKey())))
                .sorted(Comparator.comparing(FlaggedMessage::timestamp)
                        .thenComparingInt(FlaggedMessage::index))
                .toList();

        logger.debug("Dismissal analysis over {} clusters flagged {} messages", withResponses.size(), flagged.size());

        return new DismissalReport(withResponses, List.copyOf(findings), flagged);
    }

    List<RiskCluster> attachResponses(List<ScoredMessage> scored, List<RiskCluster> clusters) {
        Map<Integer, Integer> clusterOfMember = new HashMap<>();
        for (RiskCluster cluster : clusters) {
            cluster.memberIndices().forEach(index -> clusterOfMember.put(index, cluster.id()));
        }

        Map<Integer, List<Integer>> responses = new HashMap<>();
        ScoredMessage lastRisk = null;

        for (ScoredMessage message : scored) {
            if (message.containsRiskWord()) {
                lastRisk = message;
                continue;
            }
            if (lastRisk == null || !isReply(message)) continue;

            Duration elapsed = Duration.between(lastRisk.timestamp(), message.timestamp());
            Integer clusterId = clusterOfMember.get(lastRisk.index());
            if (clusterId != null && elapsed.compareTo(responseHorizon) <= 0) {
                responses.computeIfAbsent(clusterId, id -> new ArrayList<>()).add(message.index());
            }
        }

        return clusters.stream()
                .map(cluster -> cluster.withResponses(responses.getOrDefault(cluster.id(), List.of())))
                .toList();
    }

    private static boolean isReply(ScoredMessage message) {
        return message.isDismissive()
                || message.isLeadership()
                || message.isAcknowledgment()
                || message.expressesDoubt();
    }

    private static List<ScoredMessage> timeline(List<ScoredMessage> scored, RiskCluster cluster) {
        TreeSet<Integer> indices = new TreeSet<>(cluster.memberIndices());
        indices.addAll(cluster.responseIndices());
        return indices.stream().map(scored::get).toList();
    }

    /**
     * A concern is a risk message that is neither dismissive, downplaying nor an acknowledgment.
     * The dismissive side of a raise/dismiss pair is the one that gets tagged.
     */
    private static ScanState scan(List<ScoredMessage> timeline) {
        ScanState state = new ScanState();

        for (ScoredMessage message : timeline) {
            String sender = message.sender();
            boolean concernSeenBefore = state.concernCount > 0;

            if (message.isLeadership()) {
                state.unanswered = 0;
            }
            if (message.isAcknowledgment()) {
                state.openConcerns.remove(sender);
            }

            if (message.isDismissive()) {
                List<Integer> othersOpen = new ArrayList<>();
                state.openConcerns.forEach((raiser, concerns) -> {
                    if (!raiser.equals(sender)) othersOpen.addAll(concerns);
                });
                if (!othersOpen.isEmpty()) {
                    state.tag(message.index(), ReasonCode.DISMISSED_IN_CLUSTER);
                    state.dismissedConcerns.addAll(othersOpen);
                }
            } else if (isConcern(message)) {
                state.concernCount++;
                state.openConcerns.computeIfAbsent(sender, key -> new ArrayList<>()).add(message.index());

                if (!message.isLeadership()) {
                    state.unanswered++;
                    if (state.unanswered >= 2) {
                        state.tag(message.index(), ReasonCode.PERSISTENT_UNACKNOWLEDGED);
                        state.persistent = true;
                    }
                }
            }

            if (message.expressesDoubt() && !message.isLeadership() && concernSeenBefore) {
                state.tag(message.index(), ReasonCode.CONTINUED_DOUBT);
            }
        }
        return state;
    }

    private static boolean isConcern(ScoredMessage message) {
        return message.containsRiskWord()
                && !message.isDismissive()
                && !message.isDownplaying()
                && !message.isAcknowledgment();
    }

    private static final class ScanState {
        private final Map<String, List<Integer>> openConcerns = new TreeMap<>();
        private final TreeSet<Integer> dismissedConcerns = new TreeSet<>();
        private final Map<Integer, Set<ReasonCode>> tags = new TreeMap<>();
        private int concernCount;
        private int unanswered;
        private boolean persistent;

        void tag(int index, ReasonCode reason) {
            tags.computeIfAbsent(index, key -> EnumSet.noneOf(ReasonCode.class)).add(reason);
        }
    }
}
