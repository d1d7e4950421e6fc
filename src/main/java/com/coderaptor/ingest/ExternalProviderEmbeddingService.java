package com.coderaptor.ingest;

import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String provider;
    private final String apiKey;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String provider,
            String apiKey,
            int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.provider = provider;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) throws EmbeddingException {
        Request request;
        try {
            String payload = mapper.writeValueAsString(Map.of("input", text));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            request = requestBuilder.build();
        } catch (IOException | IllegalArgumentException e) {
            throw new EmbeddingException("cannot build embedding request for " + endpoint, e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new EmbeddingException("embedding provider " + provider + " returned HTTP " + response.code());
            }
            JsonNode vectorNode = mapper.readTree(body.string()).path("embedding");
            if (!vectorNode.isArray() || vectorNode.isEmpty()) {
                throw new EmbeddingException("embedding provider " + provider + " returned no embedding array");
            }
            float[] out = new float[vectorNode.size()];
            for (int i = 0; i < vectorNode.size(); i++) {
                out[i] = (float) vectorNode.get(i).asDouble();
            }
            return out;
        } catch (IOException e) {
            throw new EmbeddingException("embedding provider " + provider + " unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "external-" + provider + "-" + dimension;
    }
}
