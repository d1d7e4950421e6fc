package com.coderaptor.tree;

import java.util.List;

public record FileRecord(String path, long mtime, String contentHash, List<Long> leafIds) {
    public FileRecord {
        leafIds = leafIds == null ? List.of() : List.copyOf(leafIds);
    }

    public FileRecord withMtime(long newMtime) {
        return new FileRecord(path, newMtime, contentHash, leafIds);
    }
}
