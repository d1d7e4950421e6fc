package com.coderaptor.tree;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.ingest.ContentHash;
import com.coderaptor.ingest.SourceBatch;
import com.coderaptor.ingest.SourceFile;
import com.coderaptor.runtime.IndexWarning;
import com.coderaptor.runtime.WarningKind;

/**
 * Applies a rescanned corpus to a snapshot, rebuilding only what the changed files reach.
 *
 * <p>Leaves of modified and deleted files are dropped, every ancestor of a dropped leaf becomes
 * dirty, and the level rounds are replayed against the base snapshot so that untouched clusters
 * and their summaries are reused by reference. A base snapshot whose references disagree is
 * abandoned in favour of a full build.
 */
public class IncrementalUpdater {
    private static final Logger log = LoggerFactory.getLogger(IncrementalUpdater.class);

    private final TreeBuilder builder;
    private final FileTracker tracker;

    public IncrementalUpdater(TreeBuilder builder) {
        this(builder, new FileTracker());
    }

    public IncrementalUpdater(TreeBuilder builder, FileTracker tracker) {
        this.builder = builder;
        this.tracker = tracker;
    }

    public UpdateResult update(Snapshot base, SourceBatch batch) {
        return update(base, batch, YieldCheckpoint.unbounded(), ProgressListener.NONE);
    }

    public UpdateResult update(Snapshot base, SourceBatch batch, YieldCheckpoint checkpoint, ProgressListener listener) {
        long started = System.nanoTime();
        BuildContext context = builder.newContext(base, checkpoint, listener);
        context.addAll(batch.warnings());
        List<SourceFile> files = TreeBuilder.distinctByPath(batch.files(), context);
        ChangeSet changes = tracker.diff(base, files);
        FileCounts counts = new FileCounts(changes);
        int degradedSummaries = degradedSummaries(base);
        log.info("index.update.started baseVersion={} added={} modified={} deleted={} touched={} degradedSummaries={}",
                base.version(), counts.added(), counts.modified(), counts.deleted(), counts.touched(), degradedSummaries);

        if (!base.isEmpty() && !base.buildParameters().equals(builder.buildParameters())) {
            return fullRebuild(base, batch, checkpoint, listener, counts, started,
                    "snapshot was built with [" + base.buildParameters() + "], current settings are ["
                            + builder.buildParameters() + "]");
        }

        if (changes.isEmpty() && degradedSummaries == 0) {
            Snapshot snapshot = changes.touched().isEmpty() ? base : withTouchedRecords(base, changes.touched());
            UpdateStats stats = new UpdateStats(0, 0, 0, counts.touched(), 0, elapsed(started), context.warnings(), false);
            log.info("index.update.unchanged version={} touched={}", snapshot.version(), counts.touched());
            return new UpdateResult(snapshot, stats);
        }

        try {
            Snapshot snapshot = applyChanges(base, changes, context);
            UpdateStats stats = new UpdateStats(counts.added(), counts.modified(), counts.deleted(), counts.touched(),
                    context.nodesCreated(), elapsed(started), context.warnings(), false);
            log.info("index.update.completed version={} nodes={} rebuilt={} durationMs={} warnings={}",
                    snapshot.version(), snapshot.nodeCount(), stats.nodesRebuilt(), stats.duration().toMillis(),
                    stats.warnings().size());
            return new UpdateResult(snapshot, stats);
        } catch (StructuralInconsistencyException e) {
            return fullRebuild(base, batch, checkpoint, listener, counts, started, e.getMessage());
        }
    }

    private UpdateResult fullRebuild(Snapshot base,
            SourceBatch batch,
            YieldCheckpoint checkpoint,
            ProgressListener listener,
            FileCounts counts,
            long started,
            String reason) {
        log.warn("index.update.fallback baseVersion={} reason={}", base.version(), reason);
        BuildResult rebuilt = builder.build(batch, base, checkpoint, listener);
        List<IndexWarning> warnings = new ArrayList<>();
        warnings.add(IndexWarning.of(WarningKind.INCREMENTAL_FALLBACK, "snapshot " + base.version(), reason));
        warnings.addAll(rebuilt.stats().warnings());
        UpdateStats stats = new UpdateStats(counts.added(), counts.modified(), counts.deleted(), counts.touched(),
                rebuilt.snapshot().nodeCount(), elapsed(started), warnings, true);
        return new UpdateResult(rebuilt.snapshot(), stats);
    }

    private Snapshot applyChanges(Snapshot base, ChangeSet changes, BuildContext context) {
        Set<Long> ownedLeaves = ownedLeaves(base);
        Set<Long> removedLeaves = new HashSet<>();
        List<SourceFile> rechunk = new ArrayList<>();
        for (FileChange change : changes.changes()) {
            if (change.kind() != ChangeKind.ADDED) {
                removedLeaves.addAll(base.fileRecords().get(change.path()).leafIds());
            }
            if (change.kind() != ChangeKind.DELETED) {
                rechunk.add(change.file());
            }
        }

        Set<Long> dirty = new HashSet<>();
        for (Long leafId : removedLeaves) {
            markAncestorsDirty(base, leafId, dirty);
        }
        for (Node node : base.nodes().values()) {
            if (!node.isLeaf() && node.degraded()) {
                dirty.add(node.id());
                markAncestorsDirty(base, node.id(), dirty);
            }
        }

        Map<String, float[]> priorEmbeddings = new HashMap<>();
        for (Long leafId : removedLeaves) {
            Node leaf = base.node(leafId);
            if (leaf.hasUsableEmbedding()) {
                priorEmbeddings.put(ContentHash.sha256(leaf.text()), leaf.embedding());
            }
        }

        LeafFactory.LeafBatch fresh = builder.createLeaves(rechunk, priorEmbeddings, context);
        List<Node> leaves = new ArrayList<>();
        for (Long leafId : ownedLeaves) {
            if (!removedLeaves.contains(leafId)) {
                leaves.add(base.node(leafId));
            }
        }
        leaves.addAll(fresh.leaves());
        log.debug("index.update.dirty removedLeaves={} newLeaves={} dirtyNodes={}",
                removedLeaves.size(), fresh.leaves().size(), dirty.size());

        LevelAssembler.Assembly assembly = builder.assemble(base, leaves, dirty, context);

        Map<String, FileRecord> records = new TreeMap<>(base.fileRecords());
        for (FileChange change : changes.ofKind(ChangeKind.DELETED)) {
            records.remove(change.path());
        }
        records.putAll(fresh.records());
        changes.touched().forEach((path, mtime) -> records.computeIfPresent(path, (key, record) -> record.withMtime(mtime)));

        context.progress(BuildProgress.COMMITTING, 1, 1, "version " + (base.version() + 1));
        return new Snapshot(base.version() + 1, context.nextNodeId(), assembly.rootIds(), assembly.nodes(), records,
                base.buildParameters());
    }

    private static Set<Long> ownedLeaves(Snapshot base) {
        Set<Long> owned = new TreeSet<>();
        for (FileRecord record : base.fileRecords().values()) {
            for (Long leafId : record.leafIds()) {
                Node leaf = base.node(leafId);
                if (leaf == null || !leaf.isLeaf()) {
                    throw new StructuralInconsistencyException("file " + record.path() + " lists missing leaf " + leafId);
                }
                if (!owned.add(leafId)) {
                    throw new StructuralInconsistencyException("leaf " + leafId + " is owned by more than one file");
                }
            }
        }
        for (Node node : base.nodesAtLevel(0)) {
            if (!owned.contains(node.id())) {
                throw new StructuralInconsistencyException("leaf " + node.id() + " is not owned by any file");
            }
        }
        return owned;
    }

    private static void markAncestorsDirty(Snapshot base, long nodeId, Set<Long> dirty) {
        Set<Long> visited = new HashSet<>();
        Node node = base.node(nodeId);
        while (node != null && node.parentId() != null) {
            if (!visited.add(node.id())) {
                throw new StructuralInconsistencyException("parent cycle through node " + node.id());
            }
            Node parent = base.node(node.parentId());
            if (parent == null) {
                throw new StructuralInconsistencyException("node " + node.id() + " claims missing parent " + node.parentId());
            }
            if (!parent.childIds().contains(node.id())) {
                throw new StructuralInconsistencyException("node " + node.id() + " claims parent " + parent.id()
                        + " which does not list it");
            }
            if (!dirty.add(parent.id())) {
                return;
            }
            node = parent;
        }
    }

    private static Snapshot withTouchedRecords(Snapshot base, Map<String, Long> touched) {
        Map<String, FileRecord> records = new TreeMap<>(base.fileRecords());
        touched.forEach((path, mtime) -> records.computeIfPresent(path, (key, record) -> record.withMtime(mtime)));
        return new Snapshot(base.version() + 1, base.nextNodeId(), base.rootIds(), base.nodes(), records,
                base.buildParameters());
    }

    private static int degradedSummaries(Snapshot base) {
        int count = 0;
        for (Node node : base.nodes().values()) {
            if (!node.isLeaf() && node.degraded()) {
                count++;
            }
        }
        return count;
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private record FileCounts(int added, int modified, int deleted, int touched) {
        FileCounts(ChangeSet changes) {
            this(changes.ofKind(ChangeKind.ADDED).size(),
                    changes.ofKind(ChangeKind.MODIFIED).size(),
                    changes.ofKind(ChangeKind.DELETED).size(),
                    changes.touched().size());
        }
    }
}
