package io.riskradar.conversation.api.service;

import io.riskradar.conversation.api.dto.RiskCluster;
import io.riskradar.conversation.api.dto.ScoredMessage;
import io.riskradar.conversation.api.util.TextTokenizer;
import io.riskradar.conversation.config.ClusteringConfig;
import io.riskradar.conversation.config.RiskDetectionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Groups risk-keyword messages by text similarity. Each message becomes a term-count vector;
 * two messages are linked when their cosine similarity reaches the threshold, and every
 * connected component of that graph is one cluster. Clusters are disjoint.
 */
@Service
public class SimilarityClusterer {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityClusterer.class);

    private final ClusteringConfig clustering;
    private final Set<String> stopWords;

    public SimilarityClusterer(RiskDetectionConfig config) {
        this.clustering = config.clustering();
        this.stopWords = Set.copyOf(clustering.stopWords());
    }

    public List<RiskCluster> cluster(List<ScoredMessage> scored) {
        return cluster(scored, clustering.similarityThreshold());
    }

    public List<RiskCluster> cluster(List<ScoredMessage> scored, double threshold) {
        List<ScoredMessage> candidates = scored.stream()
                .filter(ScoredMessage::containsRiskWord)
                .toList();

        if (candidates.isEmpty()) return List.of();

        List<SortedMap<String, Integer>> vectors = candidates.stream()
                .map(message -> vectorize(message.text()))
                .toList();

        UnionFind components = new UnionFind(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                if (cosine(vectors.get(i), vectors.get(j)) >= threshold) {
                    components.union(i, j);
                }
            }
        }

        // Keyed by the smallest position in each component, so numbering follows the transcript
        TreeMap<Integer, List<Integer>> grouped = new TreeMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            grouped.computeIfAbsent(components.find(i), root -> new ArrayList<>())
                    .add(candidates.get(i).index());
        }

        List<RiskCluster> clusters = new ArrayList<>(grouped.size());
        int id = 1;
        for (List<Integer> members : grouped.values()) {
            clusters.add(new RiskCluster(id++, members, List.of()));
        }

        logger.debug("Clustered {} risk messages into {} clusters (threshold {})",
                candidates.size(), clusters.size(), threshold);
        return List.copyOf(clusters);
    }

    public double similarity(String left, String right) {
        return cosine(vectorize(left), vectorize(right));
    }

    SortedMap<String, Integer> vectorize(String text) {
        SortedMap<String, Integer> counts = new TreeMap<>();
        for (String token : TextTokenizer.words(text)) {
            if (!stopWords.contains(token)) {
                counts.merge(token, 1, Integer::sum);
            }
        }
        return counts;
    }

    /**
     * Counts are integers, so the dot product and norms are exact and the result does
     * not depend on argument order.
     */
    static double cosine(Map<String, Integer> left, Map<String, Integer> right) {
        if (left.isEmpty() || right.isEmpty()) return 0.0;

        long dot = 0;
        for (Map.Entry<String, Integer> entry : left.entrySet()) {
            Integer other = right.get(entry.getKey());
            if (other != null) {
                dot += (long) entry.getValue() * other;
            }
        }
        if (dot == 0) return 0.0;

        return dot / Math.sqrt((double) squaredNorm(left) * squaredNorm(right));
    }

    private static long squaredNorm(Map<String, Integer> vector) {
        long sum = 0;
        for (int count : vector.values()) {
            sum += (long) count * count;
        }
        return sum;
    }

    /**
     * Roots are always the smallest member of their component.
     */
    private static final class UnionFind {
        private final int[] parent;

        UnionFind(int size) {
            parent = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
        }

        int find(int node) {
            while (parent[node] != node) {
                parent[node] = parent[parent[node]];
                node = parent[node];
            }
            return node;
        }

        void union(int a, int b) {
            int rootA = find(a);
            int rootB = find(b);
            if (rootA == rootB) return;

            if (rootA < rootB) {
                parent[rootB] = rootA;
            } else {
                parent[rootA] = rootB;
            }
        }
    }
}
