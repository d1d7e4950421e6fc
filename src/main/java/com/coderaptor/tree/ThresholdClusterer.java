package com.coderaptor.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connected components of the graph whose edges join nodes with cosine similarity at or above the
 * threshold. Nodes are visited in ascending id order.
 *
 * <p>Degraded nodes and nodes whose embedding is missing, non-finite, zero or of a different
 * dimension than the first usable node become singletons. Malformed embeddings on non-degraded
 * nodes are reported in {@link Partition#isolated()}.
 */
public class ThresholdClusterer implements ClusteringStrategy {
    private static final Logger log = LoggerFactory.getLogger(ThresholdClusterer.class);

    @Override
    public Partition cluster(Collection<Node> nodes, double threshold) {
        List<Node> ordered = new ArrayList<>(nodes);
        ordered.sort(Comparator.comparingLong(Node::id));

        int dimension = -1;
        List<Node> usable = new ArrayList<>();
        List<Long> isolated = new ArrayList<>();
        boolean[] candidate = new boolean[ordered.size()];
        for (int i = 0; i < ordered.size(); i++) {
            Node node = ordered.get(i);
            if (node.degraded()) {
                continue;
            }
            float[] embedding = node.embedding();
            if (!VectorMath.isUsable(embedding)) {
                isolated.add(node.id());
                continue;
            }
            if (dimension < 0) {
                dimension = embedding.length;
            }
            if (embedding.length != dimension) {
                isolated.add(node.id());
                continue;
            }
            candidate[i] = true;
            usable.add(node);
        }
        if (!isolated.isEmpty()) {
            log.warn("cluster.isolated count={} ids={}", isolated.size(), isolated);
        }

        UnionFind unionFind = new UnionFind(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            if (!candidate[i]) {
                continue;
            }
            for (int j = i + 1; j < ordered.size(); j++) {
                if (!candidate[j] || unionFind.connected(i, j)) {
                    continue;
                }
                double similarity = VectorMath.cosine(ordered.get(i).embedding(), ordered.get(j).embedding());
                if (similarity >= threshold) {
                    unionFind.union(i, j);
                }
            }
        }

        Map<Integer, List<Long>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            byRoot.computeIfAbsent(unionFind.find(i), root -> new ArrayList<>()).add(ordered.get(i).id());
        }
        List<List<Long>> clusters = new ArrayList<>(byRoot.values());
        log.debug("cluster.completed nodes={} usable={} clusters={}", ordered.size(), usable.size(), clusters.size());
        return new Partition(clusters, isolated);
    }

    private static final class UnionFind {
        private final int[] parent;

        private UnionFind(int size) {
            parent = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
        }

        private int find(int element) {
            int root = element;
            while (parent[root] != root) {
                root = parent[root];
            }
            while (parent[element] != root) {
                int next = parent[element];
                parent[element] = root;
                element = next;
            }
            return root;
        }

        private boolean connected(int left, int right) {
            return find(left) == find(right);
        }

        // The smaller index stays the representative so components keep ascending first-member order.
        private void union(int left, int right) {
            int leftRoot = find(left);
            int rightRoot = find(right);
            if (leftRoot == rightRoot) {
                return;
            }
            if (leftRoot < rightRoot) {
                parent[rightRoot] = leftRoot;
            } else {
                parent[leftRoot] = rightRoot;
            }
        }
    }
}
