package com.coderaptor.tree;

import java.time.Duration;
import java.util.List;

import com.coderaptor.runtime.IndexWarning;

public record BuildStats(int nodeCount, int depth, Duration duration, List<IndexWarning> warnings) {
    public BuildStats {
        warnings = List.copyOf(warnings);
    }
}
