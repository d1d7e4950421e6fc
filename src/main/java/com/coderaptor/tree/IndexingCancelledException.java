package com.coderaptor.tree;

public class IndexingCancelledException extends RuntimeException {
    public IndexingCancelledException(String message) {
        super(message);
    }
}
