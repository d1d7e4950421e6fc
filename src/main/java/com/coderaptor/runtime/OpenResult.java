package com.coderaptor.runtime;

import java.util.List;

import com.coderaptor.tree.Snapshot;

public record OpenResult(Snapshot snapshot, boolean loaded, List<IndexWarning> warnings) {
    public OpenResult {
        warnings = List.copyOf(warnings);
    }
}
