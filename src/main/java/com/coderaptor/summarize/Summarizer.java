package com.coderaptor.summarize;

public interface Summarizer {
    String summarize(String input) throws SummarizationException;
}
