package com.coderaptor.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.coderaptor.fixtures.Corpora;
import com.coderaptor.fixtures.FailingEmbeddingService;
import com.coderaptor.fixtures.TaggingSummarizer;
import com.coderaptor.fixtures.TopicEmbeddingService;
import com.coderaptor.ingest.SourceBatch;
import com.coderaptor.ingest.SourceFile;
import com.coderaptor.runtime.IndexConfig;
import com.coderaptor.runtime.WarningKind;

class IncrementalUpdaterTest {
    private final ExecutorService pool = Corpora.pool();
    private final TaggingSummarizer summarizer = new TaggingSummarizer();
    private final TreeBuilder builder = Corpora.builder(Corpora.config(), new TopicEmbeddingService(), summarizer, pool);
    private final IncrementalUpdater updater = new IncrementalUpdater(builder);

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    void shouldRebuildOnlyModifiedFileAndItsAncestors() {
        Snapshot before = builder.build(Corpora.scenario()).snapshot();
        List<Long> touchingB = Corpora.nodesCovering(before, "b.txt");
        Node alphaSummary = summaryCovering(before, "a.txt");
        int summariesBefore = summarizer.calls();

        SourceBatch changed = Corpora.batch(
                Corpora.file("a.txt", "alpha", "first"),
                Corpora.file("b.txt", "beta", "second"),
                Corpora.file("c.txt", "alpha", "third"));
        UpdateResult result = updater.update(before, changed);
        Snapshot after = result.snapshot();

        assertEquals(before.version() + 1, after.version());
        assertEquals(0, result.stats().filesAdded());
        assertEquals(1, result.stats().filesModified());
        assertEquals(0, result.stats().filesDeleted());
        assertFalse(result.stats().fullRebuild());
        assertEquals(before.fileRecords().get("a.txt").leafIds(), after.fileRecords().get("a.txt").leafIds());
        assertEquals(before.fileRecords().get("c.txt").leafIds(), after.fileRecords().get("c.txt").leafIds());
        assertEquals(3, after.fileRecords().get("b.txt").leafIds().size());
        assertTrue(disjoint(before.fileRecords().get("b.txt").leafIds(), after.fileRecords().get("b.txt").leafIds()));

        for (Long id : touchingB) {
            assertFalse(after.nodes().containsKey(id), "node " + id + " covering b.txt still present");
        }
        Node alphaAfter = after.node(alphaSummary.id());
        assertEquals(alphaSummary.text(), alphaAfter.text());
        assertEquals(alphaSummary.childIds(), alphaAfter.childIds());
        for (Long leafId : alphaSummary.childIds()) {
            assertSame(before.node(leafId), after.node(leafId));
        }
        assertEquals(2, summarizer.calls() - summariesBefore);
        assertEquals(3 + 2, result.stats().nodesRebuilt());
        assertTrue(after.integrityProblems().isEmpty(), () -> after.integrityProblems().toString());
    }

    @Test
    void shouldPropagateLeafChangeUpToRoot() {
        Snapshot before = builder.build(Corpora.scenario()).snapshot();
        Node rootBefore = before.node(before.rootIds().get(0));

        Snapshot after = updater.update(before, Corpora.batch(
                Corpora.file("a.txt", "alpha", "rewritten"),
                Corpora.file("b.txt", "beta", "first"),
                Corpora.file("c.txt", "alpha", "third"))).snapshot();

        Node rootAfter = after.node(after.rootIds().get(0));
        assertNotEquals(rootBefore.text(), rootAfter.text());
        Node betaBefore = summaryCovering(before, "b.txt");
        assertEquals(betaBefore.text(), after.node(betaBefore.id()).text());
        for (Long leafId : betaBefore.childIds()) {
            assertSame(before.node(leafId), after.node(leafId));
        }
        assertFalse(after.nodes().containsKey(summaryCovering(before, "a.txt").id()));
    }

    @Test
    void shouldMatchFullRebuildAfterMixedChanges() {
        SourceBatch original = Corpora.batch(
                Corpora.file("a1.txt", "alpha", "one"),
                Corpora.file("a2.txt", "alpha", "two"),
                Corpora.file("b1.txt", "beta", "one"),
                Corpora.file("g1.txt", "gamma", "one"));
        SourceBatch changed = Corpora.batch(
                Corpora.file("a1.txt", "alpha", "one"),
                Corpora.file("a2.txt", "alpha", "two"),
                Corpora.file("g1.txt", "alpha", "moved"),
                Corpora.file("d1.txt", "delta", "new"));

        Snapshot incremental = updater.update(builder.build(original).snapshot(), changed).snapshot();
        Snapshot scratch = builder.build(changed).snapshot();

        assertEquals(Corpora.contentSignature(scratch), Corpora.contentSignature(incremental));
        assertTrue(incremental.integrityProblems().isEmpty(), () -> incremental.integrityProblems().toString());
    }

    @Test
    void shouldLeaveNoReferenceToDeletedFileLeaves() {
        Snapshot before = builder.build(Corpora.scenario()).snapshot();
        Set<Long> removed = new HashSet<>(before.fileRecords().get("b.txt").leafIds());

        UpdateResult result = updater.update(before, Corpora.batch(
                Corpora.file("a.txt", "alpha", "first"),
                Corpora.file("c.txt", "alpha", "third")));
        Snapshot after = result.snapshot();

        assertEquals(1, result.stats().filesDeleted());
        assertFalse(after.fileRecords().containsKey("b.txt"));
        for (Node node : after.nodes().values()) {
            assertFalse(removed.contains(node.id()));
            assertFalse(node.parentId() != null && removed.contains(node.parentId()));
            assertTrue(disjoint(node.childIds(), List.copyOf(removed)));
            assertFalse(node.sourcePaths().contains("b.txt"));
        }
        assertTrue(after.integrityProblems().isEmpty());
    }

    @Test
    void shouldReturnSameSnapshotWhenNothingChanged() {
        Snapshot before = builder.build(Corpora.scenario()).snapshot();

        UpdateResult result = updater.update(before, Corpora.scenario());

        assertSame(before, result.snapshot());
        assertFalse(result.stats().hasChanges());
        assertEquals(0, result.stats().nodesRebuilt());
    }

    @Test
    void shouldOnlyRefreshRecordWhenModificationTimeMoves() {
        Snapshot before = builder.build(Corpora.scenario()).snapshot();
        SourceFile a = Corpora.file("a.txt", "alpha", "first");

        UpdateResult result = updater.update(before, Corpora.batch(
                new SourceFile(a.path(), a.text(), 99_999L),
                Corpora.file("b.txt", "beta", "first"),
                Corpora.file("c.txt", "alpha", "third")));

        assertEquals(before.version() + 1, result.snapshot().version());
        assertEquals(99_999L, result.snapshot().fileRecords().get("a.txt").mtime());
        assertSame(before.nodes().get(before.rootIds().get(0)), result.snapshot().node(before.rootIds().get(0)));
        assertFalse(result.stats().hasChanges());
        assertEquals(1, result.stats().filesTouched());
        assertEquals(0, result.stats().filesModified());
    }

    @Test
    void shouldFallBackToFullRebuildOnBrokenReferences() {
        Snapshot before = builder.build(Corpora.scenario()).snapshot();
        Node betaSummary = summaryCovering(before, "b.txt");
        Long alphaLeafId = before.fileRecords().get("a.txt").leafIds().get(0);
        Map<Long, Node> corrupted = new HashMap<>(before.nodes());
        corrupted.put(alphaLeafId, before.node(alphaLeafId).withParentId(betaSummary.id()));
        Snapshot broken = new Snapshot(before.version(), before.nextNodeId(), before.rootIds(), corrupted,
                before.fileRecords(), before.buildParameters());

        UpdateResult result = updater.update(broken, Corpora.batch(
                Corpora.file("a.txt", "alpha", "first"),
                Corpora.file("b.txt", "beta", "second"),
                Corpora.file("c.txt", "alpha", "third")));

        assertTrue(result.stats().fullRebuild());
        assertEquals(WarningKind.INCREMENTAL_FALLBACK, result.stats().warnings().get(0).kind());
        assertTrue(result.snapshot().integrityProblems().isEmpty());
        assertEquals(1, result.snapshot().rootIds().size());
        assertTrue(result.snapshot().nodes().firstKey() >= broken.nextNodeId());
    }

    @Test
    void shouldRetryDegradedLeavesOnNextUpdate() {
        FailingEmbeddingService embeddings = new FailingEmbeddingService("gamma");
        TreeBuilder flakyBuilder = Corpora.builder(Corpora.config(), embeddings, new TaggingSummarizer(), pool);
        IncrementalUpdater flakyUpdater = new IncrementalUpdater(flakyBuilder);
        SourceBatch corpus = Corpora.batch(
                Corpora.file("a.txt", "alpha", "one"),
                Corpora.file("g.txt", "gamma", "one"));
        Snapshot degraded = flakyBuilder.build(corpus).snapshot();

        embeddings.setFailing(false);
        UpdateResult result = flakyUpdater.update(degraded, corpus);

        assertEquals(1, result.stats().filesModified());
        for (Long leafId : result.snapshot().fileRecords().get("g.txt").leafIds()) {
            assertFalse(result.snapshot().node(leafId).degraded());
        }
        assertEquals(1, result.snapshot().rootIds().size());
        assertTrue(result.snapshot().integrityProblems().isEmpty());
    }

    @Test
    void shouldRetryDegradedSummariesWhenNoFileChanged() {
        FailingEmbeddingService embeddings = new FailingEmbeddingService(TopicEmbeddingService.SHARED);
        TreeBuilder flakyBuilder = Corpora.builder(Corpora.config(), embeddings, new TaggingSummarizer(), pool);
        IncrementalUpdater flakyUpdater = new IncrementalUpdater(flakyBuilder);
        Snapshot degraded = flakyBuilder.build(Corpora.scenario()).snapshot();
        assertEquals(2, degraded.rootIds().size());

        embeddings.setFailing(false);
        UpdateResult result = flakyUpdater.update(degraded, Corpora.scenario());
        Snapshot repaired = result.snapshot();

        assertNotSame(degraded, repaired);
        assertEquals(degraded.version() + 1, repaired.version());
        assertFalse(result.stats().hasChanges());
        assertFalse(result.stats().fullRebuild());
        assertEquals(3, result.stats().nodesRebuilt());
        assertTrue(repaired.nodes().values().stream().noneMatch(Node::degraded));
        assertEquals(1, repaired.rootIds().size());
        for (Long leafId : degraded.fileRecords().get("a.txt").leafIds()) {
            assertTrue(repaired.nodes().containsKey(leafId));
        }
        assertEquals(Corpora.contentSignature(builder.build(Corpora.scenario()).snapshot()),
                Corpora.contentSignature(repaired));
        assertTrue(repaired.integrityProblems().isEmpty(), () -> repaired.integrityProblems().toString());
    }

    @Test
    void shouldKeepDegradedSummariesUntilEmbeddingRecovers() {
        FailingEmbeddingService embeddings = new FailingEmbeddingService(TopicEmbeddingService.SHARED);
        TreeBuilder flakyBuilder = Corpora.builder(Corpora.config(), embeddings, new TaggingSummarizer(), pool);
        IncrementalUpdater flakyUpdater = new IncrementalUpdater(flakyBuilder);
        Snapshot degraded = flakyBuilder.build(Corpora.scenario()).snapshot();

        UpdateResult result = flakyUpdater.update(degraded, Corpora.scenario());

        assertEquals(2, result.snapshot().nodesAtLevel(1).stream().filter(Node::degraded).count());
        assertEquals(2, result.stats().warnings().stream()
                .filter(w -> w.kind() == WarningKind.EMBEDDING_FAILED)
                .count());
        assertTrue(result.snapshot().integrityProblems().isEmpty());
    }

    @Test
    void shouldRebuildFromScratchWhenChunkingSettingsChanged() {
        Snapshot before = builder.build(Corpora.scenario()).snapshot();
        IndexConfig narrower = new IndexConfig(120, 20, 0, 0.82, 8, 0, 0, 0L, 100, 4000, 300, 2, 16, 500, List.of("txt"));
        TreeBuilder narrowBuilder = Corpora.builder(narrower, new TopicEmbeddingService(), new TaggingSummarizer(), pool);
        SourceBatch changed = Corpora.batch(
                Corpora.file("a.txt", "alpha", "first"),
                Corpora.file("b.txt", "beta", "second"),
                Corpora.file("c.txt", "alpha", "third"));

        UpdateResult result = new IncrementalUpdater(narrowBuilder).update(before, changed);

        assertTrue(result.stats().fullRebuild());
        assertEquals(WarningKind.INCREMENTAL_FALLBACK, result.stats().warnings().get(0).kind());
        assertEquals(1, result.stats().filesModified());
        assertEquals(narrower.buildParameters(), result.snapshot().buildParameters());
        assertEquals(before.version() + 1, result.snapshot().version());
        assertTrue(result.snapshot().nodes().firstKey() >= before.nextNodeId());
        assertEquals(Corpora.contentSignature(narrowBuilder.build(changed).snapshot()),
                Corpora.contentSignature(result.snapshot()));
    }

    private static Node summaryCovering(Snapshot snapshot, String path) {
        return snapshot.nodesAtLevel(1).stream()
                .filter(node -> node.sourcePaths().contains(path))
                .findFirst()
                .orElseThrow();
    }

    private static boolean disjoint(List<Long> left, List<Long> right) {
        Set<Long> seen = new HashSet<>(left);
        for (Long id : right) {
            if (seen.contains(id)) {
                return false;
            }
        }
        return true;
    }
}
