package com.coderaptor.ingest;

import java.util.Collection;
import java.util.List;

import com.coderaptor.runtime.IndexWarning;

public record SourceBatch(List<SourceFile> files, List<IndexWarning> warnings) {
    public SourceBatch {
        files = List.copyOf(files);
        warnings = List.copyOf(warnings);
    }

    public static SourceBatch of(Collection<SourceFile> files) {
        return new SourceBatch(List.copyOf(files), List.of());
    }
}
