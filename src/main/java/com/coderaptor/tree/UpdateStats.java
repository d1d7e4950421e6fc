package com.coderaptor.tree;

import java.time.Duration;
import java.util.List;

import com.coderaptor.runtime.IndexWarning;

// touched files only had their modification time refreshed
public record UpdateStats(
        int filesAdded,
        int filesModified,
        int filesDeleted,
        int filesTouched,
        int nodesRebuilt,
        Duration duration,
        List<IndexWarning> warnings,
        boolean fullRebuild) {

    public UpdateStats {
        warnings = List.copyOf(warnings);
    }

    public boolean hasChanges() {
        return filesAdded + filesModified + filesDeleted > 0;
    }
}
