package com.coderaptor.tree;

public record UpdateResult(Snapshot snapshot, UpdateStats stats) {
}
