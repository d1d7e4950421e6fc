package com.coderaptor.persist;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.coderaptor.fixtures.Corpora;
import com.coderaptor.fixtures.TaggingSummarizer;
import com.coderaptor.fixtures.TopicEmbeddingService;
import com.coderaptor.tree.Node;
import com.coderaptor.tree.Snapshot;

class SnapshotPersistenceTest {
    private static final String EMBEDDER = "topic-test-v1";

    @TempDir
    Path tempDir;

    private final ExecutorService pool = Corpora.pool();
    private final SnapshotPersistence persistence = new SnapshotPersistence();

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    void shouldRoundTripBuiltSnapshot() throws Exception {
        Snapshot built = buildScenario();
        Path file = tempDir.resolve("nested/index.json");

        persistence.save(file, built, EMBEDDER);
        Snapshot loaded = persistence.load(file, EMBEDDER).orElseThrow();

        assertEquals(built.version(), loaded.version());
        assertEquals(built.nextNodeId(), loaded.nextNodeId());
        assertEquals(built.rootIds(), loaded.rootIds());
        assertEquals(built.nodes().keySet(), loaded.nodes().keySet());
        assertEquals(built.fileRecords(), loaded.fileRecords());
        assertEquals(Corpora.contentSignature(built), Corpora.contentSignature(loaded));
        assertEquals(built.buildParameters(), loaded.buildParameters());
        assertTrue(Files.readString(file).contains("\"buildParameters\""));
        assertTrue(loaded.integrityProblems().isEmpty());
    }

    @Test
    void shouldLoadFileWithoutBuildParametersAsUnknown() throws Exception {
        Path file = tempDir.resolve("index.json");
        Files.writeString(file, "{ \"formatVersion\": 1, \"embeddingVersion\": \"" + EMBEDDER + "\", \"version\": 3,"
                + " \"nextNodeId\": 0, \"rootIds\": [], \"nodes\": [], \"fileRecords\": [] }");

        Snapshot loaded = persistence.load(file, EMBEDDER).orElseThrow();

        assertEquals(3L, loaded.version());
        assertEquals("", loaded.buildParameters());
    }

    @Test
    void shouldOverwriteExistingFileWithoutLeavingTempFiles() throws Exception {
        Path file = tempDir.resolve("index.json");
        persistence.save(file, buildScenario(), EMBEDDER);
        persistence.save(file, Snapshot.empty(), EMBEDDER);

        Snapshot loaded = persistence.load(file, EMBEDDER).orElseThrow();

        assertTrue(loaded.isEmpty());
        try (var listing = Files.list(tempDir)) {
            assertEquals(List.of(file), listing.toList());
        }
    }

    @Test
    void shouldReturnEmptyWhenNothingWasSaved() throws Exception {
        assertTrue(persistence.load(tempDir.resolve("missing.json"), EMBEDDER).isEmpty());
    }

    @Test
    void shouldRejectUnparseableFile() throws Exception {
        Path file = tempDir.resolve("index.json");
        Files.writeString(file, "{ \"formatVersion\": 1, \"nodes\": [");

        assertThrows(CorruptIndexException.class, () -> persistence.load(file, EMBEDDER));
    }

    @Test
    void shouldRejectMissingTables() throws Exception {
        Path file = tempDir.resolve("index.json");
        Files.writeString(file, "{ \"formatVersion\": 1, \"embeddingVersion\": \"topic-test-v1\" }");

        assertThrows(CorruptIndexException.class, () -> persistence.load(file, EMBEDDER));
    }

    @Test
    void shouldRejectDanglingReferences() throws Exception {
        Snapshot built = buildScenario();
        Map<Long, Node> nodes = new HashMap<>(built.nodes());
        Long leafId = built.fileRecords().get("a.txt").leafIds().get(0);
        nodes.put(leafId, built.node(leafId).withParentId(9_999L));
        Path file = tempDir.resolve("index.json");
        persistence.save(file, new Snapshot(built.version(), built.nextNodeId(), built.rootIds(), nodes,
                built.fileRecords()), EMBEDDER);

        CorruptIndexException error = assertThrows(CorruptIndexException.class, () -> persistence.load(file, EMBEDDER));

        assertTrue(error.getMessage().contains("9999"), error.getMessage());
    }

    @Test
    void shouldRejectSnapshotFromAnotherEmbedder() throws Exception {
        Path file = tempDir.resolve("index.json");
        persistence.save(file, buildScenario(), "other-model-v2");

        assertThrows(CorruptIndexException.class, () -> persistence.load(file, EMBEDDER));
    }

    private Snapshot buildScenario() {
        return Corpora.builder(Corpora.config(), new TopicEmbeddingService(), new TaggingSummarizer(), pool)
                .build(Corpora.scenario())
                .snapshot();
    }
}
