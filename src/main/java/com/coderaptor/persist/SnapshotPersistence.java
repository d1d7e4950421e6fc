package com.coderaptor.persist;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.coderaptor.tree.FileRecord;
import com.coderaptor.tree.Node;
import com.coderaptor.tree.Snapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class SnapshotPersistence {
    private static final Logger log = LoggerFactory.getLogger(SnapshotPersistence.class);

    static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    // temp file plus move, readers never see a partial file
    public void save(Path path, Snapshot snapshot, String embeddingVersion) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        PersistedSnapshot persisted = new PersistedSnapshot(
                FORMAT_VERSION,
                embeddingVersion,
                snapshot.buildParameters(),
                snapshot.version(),
                snapshot.nextNodeId(),
                snapshot.rootIds(),
                new ArrayList<>(snapshot.nodes().values()),
                new ArrayList<>(snapshot.fileRecords().values()));
        Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), persisted);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.info("index.saved path={} version={} nodes={} files={}", path, snapshot.version(),
                snapshot.nodeCount(), snapshot.fileRecords().size());
    }

    public Optional<Snapshot> load(Path path, String expectedEmbeddingVersion) throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        PersistedSnapshot persisted;
        try {
            persisted = objectMapper.readValue(path.toFile(), PersistedSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new CorruptIndexException("index file " + path + " is not a valid snapshot: " + e.getOriginalMessage(), e);
        }
        if (persisted == null || persisted.nodes() == null || persisted.fileRecords() == null || persisted.rootIds() == null) {
            throw new CorruptIndexException("index file " + path + " is missing its node or file tables");
        }
        if (persisted.formatVersion() != FORMAT_VERSION) {
            throw new CorruptIndexException("index file " + path + " has format " + persisted.formatVersion()
                    + ", expected " + FORMAT_VERSION);
        }
        if (!Objects.equals(persisted.embeddingVersion(), expectedEmbeddingVersion)) {
            throw new CorruptIndexException("index file " + path + " was embedded with " + persisted.embeddingVersion()
                    + ", current embedder is " + expectedEmbeddingVersion);
        }

        Map<Long, Node> nodes = new LinkedHashMap<>();
        for (Node node : persisted.nodes()) {
            if (node == null || nodes.put(node.id(), node) != null) {
                throw new CorruptIndexException("index file " + path + " has a missing or duplicate node entry");
            }
        }
        Map<String, FileRecord> records = new LinkedHashMap<>();
        for (FileRecord record : persisted.fileRecords()) {
            if (record == null || record.path() == null || records.put(record.path(), record) != null) {
                throw new CorruptIndexException("index file " + path + " has a missing or duplicate file record");
            }
        }
        Snapshot snapshot;
        try {
            snapshot = new Snapshot(persisted.version(), persisted.nextNodeId(), persisted.rootIds(), nodes, records,
                    persisted.buildParameters());
        } catch (NullPointerException e) {
            throw new CorruptIndexException("index file " + path + " has a null root id", e);
        }
        List<String> problems = snapshot.integrityProblems();
        if (!problems.isEmpty()) {
            throw new CorruptIndexException("index file " + path + " failed integrity checks: "
                    + String.join("; ", problems.subList(0, Math.min(5, problems.size()))));
        }
        log.info("index.loaded path={} version={} nodes={} files={}", path, snapshot.version(),
                snapshot.nodeCount(), records.size());
        return Optional.of(snapshot);
    }
}
