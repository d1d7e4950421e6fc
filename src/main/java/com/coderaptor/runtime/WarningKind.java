package com.coderaptor.runtime;

public enum WarningKind {
    IO_ERROR,
    DUPLICATE_PATH,
    EMBEDDING_FAILED,
    SUMMARY_FALLBACK,
    CLUSTERING_ISOLATED,
    CORRUPT_INDEX,
    INCREMENTAL_FALLBACK,
    STALE_BASE
}
