package com.coderaptor.persist;

public class CorruptIndexException extends RuntimeException {
    public CorruptIndexException(String message) {
        super(message);
    }

    public CorruptIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
