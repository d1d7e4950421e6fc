package com.coderaptor.ingest;

import java.util.ArrayList;
import java.util.List;

public class Chunker {
    private final int maxChars;
    private final int overlap;
    private final int boundaryLookback;

    public Chunker(int maxChars, int overlap, int boundaryLookback) {
        if (maxChars <= 0 || overlap < 0 || overlap >= maxChars) {
            throw new IllegalArgumentException("require 0 <= overlap < maxChars, got overlap=" + overlap + " maxChars=" + maxChars);
        }
        if (boundaryLookback < 0) {
            throw new IllegalArgumentException("boundaryLookback must be >= 0");
        }
        this.maxChars = maxChars;
        this.overlap = overlap;
        this.boundaryLookback = boundaryLookback;
    }

    public List<Chunk> chunk(String path, String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        int length = text.length();
        List<Chunk> chunks = new ArrayList<>();
        int start = 0;
        while (length - start > maxChars) {
            int end = cutPoint(text, start, start + maxChars);
            chunks.add(span(path, text, start, end));
            start = end - overlap;
        }
        chunks.add(span(path, text, start, length));
        return chunks;
    }

    private int cutPoint(String text, int start, int hardEnd) {
        // the next chunk starts at cut - overlap, which has to move forward
        int floor = Math.max(start + overlap + 1, hardEnd - boundaryLookback);
        for (int cut = hardEnd; cut >= floor; cut--) {
            if (Character.isWhitespace(text.charAt(cut - 1))) {
                return cut;
            }
        }
        if (Character.isHighSurrogate(text.charAt(hardEnd - 1)) && hardEnd - 1 > start + overlap) {
            return hardEnd - 1;
        }
        return hardEnd;
    }

    private static Chunk span(String path, String text, int start, int end) {
        String slice = text.substring(start, end);
        return new Chunk(path, start, end, slice, ContentHash.sha256(slice));
    }
}
