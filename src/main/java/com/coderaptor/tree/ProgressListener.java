package com.coderaptor.tree;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = progress -> {
    };

    void onProgress(BuildProgress progress);
}
