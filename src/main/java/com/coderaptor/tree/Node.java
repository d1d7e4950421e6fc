package com.coderaptor.tree;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

// anchor is "path NUL offset" of the earliest covered chunk and orders cluster members.
@JsonIgnoreProperties(ignoreUnknown = true)
public record Node(
        long id,
        int level,
        String text,
        float[] embedding,
        Long parentId,
        List<Long> childIds,
        SortedSet<String> sourcePaths,
        String anchor,
        boolean degraded) {

    public Node {
        text = text == null ? "" : text;
        childIds = childIds == null ? List.of() : List.copyOf(childIds);
        sourcePaths = Collections.unmodifiableSortedSet(sourcePaths == null ? new TreeSet<>() : new TreeSet<>(sourcePaths));
        anchor = anchor == null ? "" : anchor;
    }

    public static Node leaf(long id, String sourcePath, int startOffset, String text, float[] embedding) {
        return new Node(id, 0, text, embedding, null, List.of(), new TreeSet<>(Set.of(sourcePath)),
                anchorFor(sourcePath, startOffset), embedding == null);
    }

    public static String anchorFor(String sourcePath, int startOffset) {
        return sourcePath + '\u0000' + String.format("%010d", startOffset);
    }

    @JsonIgnore
    public boolean isLeaf() {
        return level == 0 && childIds.isEmpty();
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentId == null;
    }

    @JsonIgnore
    public boolean hasUsableEmbedding() {
        return !degraded && embedding != null && embedding.length > 0;
    }

    public Node withParentId(Long newParentId) {
        return new Node(id, level, text, embedding, newParentId, childIds, sourcePaths, anchor, degraded);
    }

    @Override
    public String toString() {
        return "Node{id=" + id + ", level=" + level + ", parent=" + parentId + ", children=" + childIds
                + ", paths=" + sourcePaths + ", degraded=" + degraded + "}";
    }
}
