package com.coderaptor.ingest;

public record SourceFile(String path, String text, long mtime) {
    public SourceFile {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        text = text == null ? "" : text;
    }
}
