package com.coderaptor.fixtures;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

import com.coderaptor.ingest.ContentHash;
import com.coderaptor.ingest.EmbeddingException;
import com.coderaptor.ingest.EmbeddingService;

/**
 * Deterministic embedder whose axes count topic words. Texts about different topics are nearly
 * orthogonal; a small hash-derived component keeps distinct texts distinct.
 */
public class TopicEmbeddingService implements EmbeddingService {
    public static final List<String> TOPICS = List.of("alpha", "beta", "gamma", "delta");
    public static final String SHARED = "module";

    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public float[] embed(String text) throws EmbeddingException {
        calls.incrementAndGet();
        float[] vector = new float[dimension()];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z]+")) {
            int axis = TOPICS.indexOf(token);
            if (axis >= 0) {
                vector[axis] += 1f;
            } else if (SHARED.equals(token)) {
                vector[TOPICS.size()] += 1f;
            }
        }
        int hash = Integer.parseInt(ContentHash.sha256(text).substring(0, 2), 16);
        vector[TOPICS.size() + 1] = 0.01f + (hash / 255f) * 0.04f;
        return vector;
    }

    @Override
    public int dimension() {
        return TOPICS.size() + 2;
    }

    @Override
    public String version() {
        return "topic-test-v1";
    }

    public int calls() {
        return calls.get();
    }
}
