package com.coderaptor.tree;

public record BuildProgress(String stage, int current, int total, String detail) {
    public static final String EMBEDDING = "embedding";
    public static final String CLUSTERING = "clustering";
    public static final String SUMMARIZING = "summarizing";
    public static final String COMMITTING = "committing";
}
