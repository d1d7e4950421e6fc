package com.coderaptor.tree;

import java.util.List;

public record Partition(List<List<Long>> clusters, List<Long> isolated) {
    public Partition {
        clusters = clusters.stream().map(List::copyOf).toList();
        isolated = List.copyOf(isolated);
    }

    public int mergedClusterCount() {
        return (int) clusters.stream().filter(cluster -> cluster.size() > 1).count();
    }
}
