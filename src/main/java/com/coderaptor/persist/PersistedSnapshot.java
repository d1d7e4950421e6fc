package com.coderaptor.persist;

import java.util.List;

import com.coderaptor.tree.FileRecord;
import com.coderaptor.tree.Node;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PersistedSnapshot(
        int formatVersion,
        String embeddingVersion,
        String buildParameters,
        long version,
        long nextNodeId,
        List<Long> rootIds,
        List<Node> nodes,
        List<FileRecord> fileRecords) {
}
