package com.coderaptor.tree;

import java.util.Collection;

public interface ClusteringStrategy {
    Partition cluster(Collection<Node> nodes, double threshold);
}
