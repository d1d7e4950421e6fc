package com.coderaptor.tree;

public record BuildResult(Snapshot snapshot, BuildStats stats) {
}
