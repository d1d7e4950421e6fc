package com.coderaptor.tree;

import com.coderaptor.ingest.SourceFile;

public record FileChange(String path, ChangeKind kind, SourceFile file) {
}
