package com.coderaptor.retrieval;

import java.util.List;

public record ContextRetrieval(List<RetrievalResult> summaries, List<RetrievalResult> chunks, boolean expanded) {
    public ContextRetrieval {
        summaries = List.copyOf(summaries);
        chunks = List.copyOf(chunks);
    }
}
