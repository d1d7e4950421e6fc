package com.coderaptor.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.ingest.EmbeddingCache;
import com.coderaptor.ingest.EmbeddingException;
import com.coderaptor.runtime.WarningKind;
import com.coderaptor.summarize.RetryingSummarizer;
import com.coderaptor.summarize.SummaryOutcome;

/**
 * Runs the cluster and summarize rounds from a set of leaves up to the roots.
 *
 * <p>Every round is compared against the same round of a base snapshot. Base clusters whose members
 * are all still present, whose parent is not dirty and which gain no new similar neighbour are
 * kept by reference together with their parent. Only the remaining nodes are clustered again and
 * only their clusters get new summaries. Against {@link Snapshot#empty()} this is a full build.
 */
final class LevelAssembler {
    private static final Logger log = LoggerFactory.getLogger(LevelAssembler.class);

    private static final Comparator<Node> SUMMARY_ORDER =
            Comparator.comparing(Node::anchor).thenComparingLong(Node::id);

    private final ClusteringStrategy clusterer;
    private final RetryingSummarizer summarizer;
    private final EmbeddingCache cache;
    private final double threshold;
    private final int maxDepth;

    LevelAssembler(ClusteringStrategy clusterer,
            RetryingSummarizer summarizer,
            EmbeddingCache cache,
            double threshold,
            int maxDepth) {
        this.clusterer = clusterer;
        this.summarizer = summarizer;
        this.cache = cache;
        this.threshold = threshold;
        this.maxDepth = maxDepth;
    }

    /**
     * @param base   snapshot whose structure may be reused
     * @param leaves every current leaf, kept or new
     * @param dirty  base node ids that must not be reused
     * @throws StructuralInconsistencyException when the base parent/child references disagree
     */
    Assembly assemble(Snapshot base, Collection<Node> leaves, Set<Long> dirty, BuildContext context) {
        Map<Long, Node> available = new HashMap<>();
        for (Node leaf : leaves) {
            available.put(leaf.id(), leaf);
        }
        List<Long> frontier = sortedIds(available.keySet());
        List<Long> baseFrontier = base.nodesAtLevel(0).stream().map(Node::id).sorted().toList();

        int round = 0;
        while (frontier.size() > 1 && round < maxDepth) {
            context.checkpoint().throwIfCancelled();
            context.progress(BuildProgress.CLUSTERING, round + 1, maxDepth, "level " + round + " nodes=" + frontier.size());

            Set<Long> present = new HashSet<>(frontier);
            Set<Long> previous = new HashSet<>(baseFrontier);
            List<Node> added = new ArrayList<>();
            for (Long id : frontier) {
                if (!previous.contains(id)) {
                    added.add(available.get(id));
                }
            }

            List<BaseCluster> baseClusters = baseClustersAt(base, baseFrontier, round);
            Map<Set<Long>, Long> reusableParents = new HashMap<>();
            Set<Long> toRecluster = new LinkedHashSet<>();
            added.forEach(node -> toRecluster.add(node.id()));
            List<Long> next = new ArrayList<>();
            int merged = 0;
            int reused = 0;

            for (BaseCluster cluster : baseClusters) {
                if (cluster.parentId() != null && !dirty.contains(cluster.parentId())) {
                    reusableParents.put(Set.copyOf(cluster.members()), cluster.parentId());
                }
                if (isAffected(cluster, present, added, dirty, available)) {
                    for (Long member : cluster.members()) {
                        if (present.contains(member)) {
                            toRecluster.add(member);
                        }
                    }
                } else if (cluster.parentId() == null) {
                    next.add(cluster.members().get(0));
                } else {
                    available.put(cluster.parentId(), base.node(cluster.parentId()));
                    next.add(cluster.parentId());
                    merged++;
                    reused++;
                }
            }

            List<Node> candidates = toRecluster.stream().map(available::get).toList();
            Partition partition = clusterer.cluster(candidates, threshold);
            for (Long isolated : partition.isolated()) {
                context.warn(WarningKind.CLUSTERING_ISOLATED, "node " + isolated,
                        "embedding is malformed, kept as a singleton at level " + round);
            }
            int summarized = 0;
            int toSummarize = partition.mergedClusterCount();
            for (List<Long> cluster : partition.clusters()) {
                if (cluster.size() == 1) {
                    next.add(cluster.get(0));
                    continue;
                }
                merged++;
                Long reusable = reusableParents.get(Set.copyOf(cluster));
                if (reusable != null) {
                    available.put(reusable, base.node(reusable));
                    next.add(reusable);
                    reused++;
                    continue;
                }
                Node parent = summarize(cluster, round + 1, available, context);
                available.put(parent.id(), parent);
                next.add(parent.id());
                summarized++;
                context.progress(BuildProgress.SUMMARIZING, summarized, toSummarize, "level " + (round + 1));
            }

            log.debug("tree.round round={} frontier={} reclustered={} merged={} reused={} summarized={}",
                    round, frontier.size(), candidates.size(), merged, reused, summarized);
            context.checkpoint().levelCompleted();
            if (merged == 0) {
                break;
            }
            frontier = sortedIds(next);
            baseFrontier = nextBaseFrontier(baseClusters);
            round++;
        }

        SortedMap<Long, Node> nodes = materialize(frontier, available);
        return new Assembly(nodes, frontier, round);
    }

    private boolean isAffected(BaseCluster cluster,
            Set<Long> present,
            List<Node> added,
            Set<Long> dirty,
            Map<Long, Node> available) {
        if (cluster.parentId() != null && dirty.contains(cluster.parentId())) {
            return true;
        }
        for (Long member : cluster.members()) {
            if (!present.contains(member)) {
                return true;
            }
        }
        for (Long member : cluster.members()) {
            Node node = available.get(member);
            for (Node newcomer : added) {
                if (similar(node, newcomer)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean similar(Node left, Node right) {
        if (!left.hasUsableEmbedding() || !right.hasUsableEmbedding()) {
            return false;
        }
        if (!VectorMath.isUsable(left.embedding()) || !VectorMath.isUsable(right.embedding())
                || left.embedding().length != right.embedding().length) {
            return false;
        }
        return VectorMath.cosine(left.embedding(), right.embedding()) >= threshold;
    }

    private Node summarize(List<Long> memberIds, int level, Map<Long, Node> available, BuildContext context) {
        List<Node> members = new ArrayList<>(memberIds.size());
        for (Long id : memberIds) {
            members.add(available.get(id));
        }
        members.sort(SUMMARY_ORDER);

        long id = context.allocateId();
        SummaryOutcome outcome = summarizer.summarize(members.stream().map(Node::text).toList());
        if (outcome.fallbackUsed()) {
            context.warn(WarningKind.SUMMARY_FALLBACK, "node " + id, outcome.failureMessage());
        }
        float[] embedding = null;
        try {
            embedding = cache.getOrCompute(outcome.text());
        } catch (EmbeddingException e) {
            context.warn(WarningKind.EMBEDDING_FAILED, "node " + id, "summary degraded: " + e.getMessage());
        }

        TreeSet<String> sourcePaths = new TreeSet<>();
        members.forEach(member -> sourcePaths.addAll(member.sourcePaths()));
        context.checkpoint().tick();
        return new Node(id, level, outcome.text(), embedding, null, sortedIds(memberIds), sourcePaths,
                members.get(0).anchor(), embedding == null);
    }

    private static List<BaseCluster> baseClustersAt(Snapshot base, List<Long> baseFrontier, int round) {
        Map<Long, List<Long>> byParent = new LinkedHashMap<>();
        List<BaseCluster> clusters = new ArrayList<>();
        for (Long id : baseFrontier) {
            Node node = base.node(id);
            if (node == null) {
                throw new StructuralInconsistencyException("node " + id + " is missing from snapshot " + base.version());
            }
            Long parentId = node.parentId();
            if (parentId == null) {
                clusters.add(new BaseCluster(List.of(id), null));
                continue;
            }
            Node parent = base.node(parentId);
            if (parent == null) {
                throw new StructuralInconsistencyException("node " + id + " claims missing parent " + parentId);
            }
            if (!parent.childIds().contains(id)) {
                throw new StructuralInconsistencyException("node " + id + " claims parent " + parentId
                        + " which does not list it");
            }
            if (parent.level() <= round) {
                throw new StructuralInconsistencyException("parent " + parentId + " at level " + parent.level()
                        + " sits in round " + round);
            }
            if (parent.level() == round + 1) {
                byParent.computeIfAbsent(parentId, key -> new ArrayList<>()).add(id);
            } else {
                clusters.add(new BaseCluster(List.of(id), null));
            }
        }
        for (Map.Entry<Long, List<Long>> entry : byParent.entrySet()) {
            Node parent = base.node(entry.getKey());
            if (parent.childIds().size() != entry.getValue().size()) {
                throw new StructuralInconsistencyException("parent " + parent.id() + " lists " + parent.childIds()
                        + " but level " + round + " holds " + entry.getValue());
            }
            clusters.add(new BaseCluster(List.copyOf(entry.getValue()), entry.getKey()));
        }
        return clusters;
    }

    private static List<Long> nextBaseFrontier(List<BaseCluster> clusters) {
        List<Long> next = new ArrayList<>(clusters.size());
        for (BaseCluster cluster : clusters) {
            next.add(cluster.parentId() == null ? cluster.members().get(0) : cluster.parentId());
        }
        return sortedIds(next);
    }

    private static SortedMap<Long, Node> materialize(List<Long> roots, Map<Long, Node> available) {
        SortedMap<Long, Node> nodes = new TreeMap<>();
        Deque<Placement> stack = new ArrayDeque<>();
        for (Long root : roots) {
            stack.push(new Placement(root, null));
        }
        while (!stack.isEmpty()) {
            Placement placement = stack.pop();
            Node node = available.get(placement.id());
            if (node == null) {
                throw new StructuralInconsistencyException("node " + placement.id() + " is unreachable during assembly");
            }
            if (nodes.containsKey(node.id())) {
                throw new StructuralInconsistencyException("node " + node.id() + " is reachable twice");
            }
            Node placed = Objects.equals(node.parentId(), placement.parentId()) ? node : node.withParentId(placement.parentId());
            nodes.put(placed.id(), placed);
            for (Long childId : node.childIds()) {
                stack.push(new Placement(childId, node.id()));
            }
        }
        return nodes;
    }

    private static List<Long> sortedIds(Collection<Long> ids) {
        return ids.stream().sorted().toList();
    }

    record Assembly(SortedMap<Long, Node> nodes, List<Long> rootIds, int rounds) {
    }

    private record BaseCluster(List<Long> members, Long parentId) {
    }

    private record Placement(long id, Long parentId) {
    }
}
