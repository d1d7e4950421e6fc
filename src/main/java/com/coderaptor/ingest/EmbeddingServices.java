package com.coderaptor.ingest;

import java.util.Map;

import com.coderaptor.runtime.ConfigException;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    public static final int DEFAULT_DIMENSION = 384;

    private EmbeddingServices() {
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient) {
        return fromEnvironment(httpClient, System.getenv());
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient, Map<String, String> env) {
        String endpoint = env.get("CODERAPTOR_EMBEDDING_URL");
        if (endpoint == null || endpoint.isBlank()) {
            return new LocalModelEmbeddingService(DEFAULT_DIMENSION);
        }
        String provider = env.getOrDefault("CODERAPTOR_EMBEDDING_PROVIDER", "custom");
        String apiKey = env.get("CODERAPTOR_EMBEDDING_API_KEY");
        return new ExternalProviderEmbeddingService(httpClient, endpoint, provider, apiKey, dimension(env));
    }

    private static int dimension(Map<String, String> env) {
        String raw = env.getOrDefault("CODERAPTOR_EMBEDDING_DIMENSION", String.valueOf(DEFAULT_DIMENSION));
        int dimension;
        try {
            dimension = Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            throw new ConfigException("CODERAPTOR_EMBEDDING_DIMENSION must be an integer, was '" + raw + "'", e);
        }
        if (dimension <= 0) {
            throw new ConfigException("CODERAPTOR_EMBEDDING_DIMENSION must be > 0, was " + dimension);
        }
        return dimension;
    }
}
