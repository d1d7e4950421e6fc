package com.coderaptor.retrieval;

import java.util.Locale;
import java.util.SortedSet;

public record RetrievalResult(long nodeId, int level, String text, SortedSet<String> sourcePaths, double score) {

    public boolean isLeaf() {
        return level == 0;
    }

    public String citationSnippet() {
        String trimmed = text.strip();
        if (trimmed.length() > 240) {
            trimmed = trimmed.substring(0, 240) + "...";
        }
        return String.format(Locale.ROOT, "%s [level %d, score %.3f] %s",
                String.join(", ", sourcePaths),
                level,
                score,
                trimmed.replaceAll("\\s+", " "));
    }
}
