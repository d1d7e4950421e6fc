package com.coderaptor.tree;

import java.util.List;
import java.util.Map;

public record ChangeSet(List<FileChange> changes, Map<String, Long> touched) {
    public ChangeSet {
        changes = List.copyOf(changes);
        touched = Map.copyOf(touched);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public List<FileChange> ofKind(ChangeKind kind) {
        return changes.stream().filter(change -> change.kind() == kind).toList();
    }
}
