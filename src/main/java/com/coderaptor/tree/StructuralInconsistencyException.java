package com.coderaptor.tree;

public class StructuralInconsistencyException extends RuntimeException {
    public StructuralInconsistencyException(String message) {
        super(message);
    }
}
