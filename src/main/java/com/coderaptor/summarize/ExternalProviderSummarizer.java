package com.coderaptor.summarize;

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

public class ExternalProviderSummarizer implements Summarizer {
    static final String PROMPT_PREFIX = "Summarize the following code fragments in 1-2 sentences:\n";
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String apiKey;

    public ExternalProviderSummarizer(OkHttpClient httpClient, String endpoint, String apiKey) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override
    public String summarize(String input) throws SummarizationException {
        Request request;
        try {
            String payload = mapper.writeValueAsString(Map.of("prompt", PROMPT_PREFIX + input));
            Request.Builder builder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                builder.header("Authorization", "Bearer " + apiKey);
            }
            request = builder.build();
        } catch (IOException | IllegalArgumentException e) {
            throw new SummarizationException("cannot build summary request for " + endpoint, e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new SummarizationException("summary provider returned HTTP " + response.code());
            }
            JsonNode root = mapper.readTree(body.string());
            String summary = root.path("summary").asText("");
            if (summary.isBlank()) {
                summary = root.path("response").asText("");
            }
            if (summary.isBlank()) {
                throw new SummarizationException("summary provider returned an empty summary");
            }
            return summary.strip();
        } catch (IOException e) {
            throw new SummarizationException("summary provider unavailable: " + e.getMessage(), e);
        }
    }
}
