package com.coderaptor.ingest;

public interface EmbeddingService {
    float[] embed(String text) throws EmbeddingException;

    int dimension();

    default String version() {
        return "unversioned";
    }
}
