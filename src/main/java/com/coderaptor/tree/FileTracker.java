package com.coderaptor.tree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.coderaptor.ingest.ContentHash;
import com.coderaptor.ingest.SourceFile;

public class FileTracker {

    public ChangeSet diff(Snapshot base, List<SourceFile> incoming) {
        List<FileChange> changes = new ArrayList<>();
        Map<String, Long> touched = new HashMap<>();
        Set<String> seen = new HashSet<>();
        for (SourceFile file : incoming) {
            seen.add(file.path());
            FileRecord record = base.fileRecords().get(file.path());
            if (record == null) {
                changes.add(new FileChange(file.path(), ChangeKind.ADDED, file));
            } else if (!record.contentHash().equals(ContentHash.sha256(file.text())) || hasDegradedLeaf(base, record)) {
                changes.add(new FileChange(file.path(), ChangeKind.MODIFIED, file));
            } else if (record.mtime() != file.mtime()) {
                touched.put(file.path(), file.mtime());
            }
        }
        for (String path : base.fileRecords().keySet()) {
            if (!seen.contains(path)) {
                changes.add(new FileChange(path, ChangeKind.DELETED, null));
            }
        }
        changes.sort(Comparator.comparing(FileChange::path));
        return new ChangeSet(changes, touched);
    }

    private static boolean hasDegradedLeaf(Snapshot base, FileRecord record) {
        for (Long leafId : record.leafIds()) {
            Node leaf = base.node(leafId);
            if (leaf != null && leaf.degraded()) {
                return true;
            }
        }
        return false;
    }
}
