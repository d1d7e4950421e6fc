package com.coderaptor.summarize;

public class SummarizationException extends Exception {
    public SummarizationException(String message) {
        super(message);
    }

    public SummarizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
