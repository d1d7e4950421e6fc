package com.coderaptor.ingest;

public record Chunk(String sourcePath, int startOffset, int endOffset, String text, String contentHash) {

    public int length() {
        return endOffset - startOffset;
    }
}
