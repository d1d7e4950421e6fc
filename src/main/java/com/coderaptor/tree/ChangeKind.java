package com.coderaptor.tree;

public enum ChangeKind {
    ADDED,
    MODIFIED,
    DELETED
}
