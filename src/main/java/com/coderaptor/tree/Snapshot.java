package com.coderaptor.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

public final class Snapshot {
    private static final Snapshot EMPTY = new Snapshot(0L, 0L, List.of(), Map.of(), Map.of());

    private final long version;
    private final long nextNodeId;
    private final List<Long> rootIds;
    private final SortedMap<Long, Node> nodes;
    private final SortedMap<String, FileRecord> fileRecords;
    private final String buildParameters;

    public Snapshot(long version,
            long nextNodeId,
            List<Long> rootIds,
            Map<Long, Node> nodes,
            Map<String, FileRecord> fileRecords) {
        this(version, nextNodeId, rootIds, nodes, fileRecords, "");
    }

    public Snapshot(long version,
            long nextNodeId,
            List<Long> rootIds,
            Map<Long, Node> nodes,
            Map<String, FileRecord> fileRecords,
            String buildParameters) {
        this.version = version;
        this.nextNodeId = nextNodeId;
        this.rootIds = List.copyOf(rootIds);
        this.nodes = Collections.unmodifiableSortedMap(new TreeMap<>(nodes));
        this.fileRecords = Collections.unmodifiableSortedMap(new TreeMap<>(fileRecords));
        this.buildParameters = buildParameters == null ? "" : buildParameters;
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    public long version() {
        return version;
    }

    public long nextNodeId() {
        return nextNodeId;
    }

    public List<Long> rootIds() {
        return rootIds;
    }

    public SortedMap<Long, Node> nodes() {
        return nodes;
    }

    public SortedMap<String, FileRecord> fileRecords() {
        return fileRecords;
    }

    public String buildParameters() {
        return buildParameters;
    }

    public Node node(long id) {
        return nodes.get(id);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int depth() {
        int maxLevel = -1;
        for (Node node : nodes.values()) {
            maxLevel = Math.max(maxLevel, node.level());
        }
        return maxLevel + 1;
    }

    public List<Node> nodesAtLevel(int level) {
        return nodes.values().stream().filter(node -> node.level() == level).toList();
    }

    public SortedMap<Integer, Integer> levelHistogram() {
        SortedMap<Integer, Integer> histogram = new TreeMap<>();
        for (Node node : nodes.values()) {
            histogram.merge(node.level(), 1, Integer::sum);
        }
        return histogram;
    }

    /**
     * Checks referential integrity and tree shape. An empty list means the snapshot is servable.
     */
    public List<String> integrityProblems() {
        List<String> problems = new ArrayList<>();
        Set<Long> roots = new HashSet<>(rootIds);
        if (roots.size() != rootIds.size()) {
            problems.add("duplicate root ids " + rootIds);
        }
        for (Long rootId : rootIds) {
            Node root = nodes.get(rootId);
            if (root == null) {
                problems.add("root " + rootId + " does not resolve");
            } else if (root.parentId() != null) {
                problems.add("root " + rootId + " has parent " + root.parentId());
            }
        }
        for (Map.Entry<Long, Node> entry : nodes.entrySet()) {
            Node node = entry.getValue();
            if (node.id() != entry.getKey()) {
                problems.add("node keyed " + entry.getKey() + " carries id " + node.id());
            }
            if (node.id() >= nextNodeId) {
                problems.add("node " + node.id() + " is not below nextNodeId " + nextNodeId);
            }
            if (node.parentId() == null) {
                if (!roots.contains(node.id())) {
                    problems.add("node " + node.id() + " has no parent and is not a root");
                }
            } else {
                Node parent = nodes.get(node.parentId());
                if (parent == null) {
                    problems.add("node " + node.id() + " claims missing parent " + node.parentId());
                } else if (!parent.childIds().contains(node.id())) {
                    problems.add("node " + node.id() + " claims parent " + parent.id() + " which does not list it");
                }
            }
            Set<String> childPaths = new HashSet<>();
            for (Long childId : node.childIds()) {
                Node child = nodes.get(childId);
                if (child == null) {
                    problems.add("node " + node.id() + " lists missing child " + childId);
                    continue;
                }
                if (!Objects.equals(child.parentId(), node.id())) {
                    problems.add("child " + childId + " of " + node.id() + " points at " + child.parentId());
                }
                if (child.level() >= node.level()) {
                    problems.add("child " + childId + " is not below parent " + node.id());
                }
                childPaths.addAll(child.sourcePaths());
            }
            if (!node.childIds().isEmpty() && !childPaths.equals(node.sourcePaths())) {
                problems.add("node " + node.id() + " source paths differ from the union of its children");
            }
            if (node.childIds().isEmpty() && node.level() != 0) {
                problems.add("summary node " + node.id() + " has no children");
            }
        }
        for (FileRecord record : fileRecords.values()) {
            for (Long leafId : record.leafIds()) {
                Node leaf = nodes.get(leafId);
                if (leaf == null || !leaf.isLeaf()) {
                    problems.add("file " + record.path() + " lists missing leaf " + leafId);
                } else if (!leaf.sourcePaths().equals(Set.of(record.path()))) {
                    problems.add("leaf " + leafId + " is not owned by " + record.path());
                }
            }
        }
        return problems;
    }

    @Override
    public String toString() {
        return "Snapshot{version=" + version + ", nodes=" + nodes.size() + ", roots=" + rootIds.size()
                + ", files=" + fileRecords.size() + "}";
    }
}
