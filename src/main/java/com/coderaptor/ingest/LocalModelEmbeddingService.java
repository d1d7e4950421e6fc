package com.coderaptor.ingest;

import java.util.Locale;
import java.util.regex.Pattern;

public class LocalModelEmbeddingService implements EmbeddingService {
    private static final String VERSION = "local-ngram-v1";
    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^A-Za-z0-9_]+");
    private static final Pattern IDENTIFIER_PARTS = Pattern.compile("_|(?<=[a-z0-9])(?=[A-Z])");

    private final int dimension;

    public LocalModelEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        for (String raw : TOKEN_SPLIT.split(text)) {
            if (raw.isBlank()) {
                continue;
            }
            String token = raw.toLowerCase(Locale.ROOT);
            addHashed(vector, "tok:" + token, 1.0f);
            String[] parts = IDENTIFIER_PARTS.split(raw);
            if (parts.length > 1) {
                for (String part : parts) {
                    if (!part.isBlank()) {
                        addHashed(vector, "part:" + part.toLowerCase(Locale.ROOT), 0.6f);
                    }
                }
            }
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f);
                }
            }
        }

        normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION + "-" + dimension;
    }

    private static void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }

    private static void normalize(float[] vector) {
        float norm = 0f;
        for (float value : vector) {
            norm += value * value;
        }
        norm = (float) Math.sqrt(norm);
        if (norm <= 0f) {
            return;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] /= norm;
        }
    }
}
