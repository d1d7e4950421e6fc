package com.coderaptor.ingest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

class ExternalProviderEmbeddingServiceTest {

    @Test
    void shouldPostInputAndParseEmbedding() throws Exception {
        AtomicReference<Request> seen = new AtomicReference<>();
        OkHttpClient client = fakeClient(200, "{\"embedding\":[0.5,0.25,1.0]}", seen);
        ExternalProviderEmbeddingService service =
                new ExternalProviderEmbeddingService(client, "http://embeddings.test/v1", "acme", "secret", 3);

        float[] vector = service.embed("hello");

        assertArrayEquals(new float[] { 0.5f, 0.25f, 1.0f }, vector);
        assertEquals("Bearer secret", seen.get().header("Authorization"));
        assertEquals("POST", seen.get().method());
        assertEquals("application/json", seen.get().body().contentType().type() + "/" + seen.get().body().contentType().subtype());
        assertEquals("external-acme-3", service.version());
    }

    @Test
    void shouldFailOnHttpError() {
        OkHttpClient client = fakeClient(503, "{}", new AtomicReference<>());
        ExternalProviderEmbeddingService service =
                new ExternalProviderEmbeddingService(client, "http://embeddings.test/v1", "acme", null, 3);

        EmbeddingException error = assertThrows(EmbeddingException.class, () -> service.embed("hello"));
        assertTrue(error.getMessage().contains("503"));
    }

    @Test
    void shouldFailOnMissingEmbeddingArray() {
        OkHttpClient client = fakeClient(200, "{\"embedding\":[]}", new AtomicReference<>());
        ExternalProviderEmbeddingService service =
                new ExternalProviderEmbeddingService(client, "http://embeddings.test/v1", "acme", null, 3);

        assertThrows(EmbeddingException.class, () -> service.embed("hello"));
    }

    @Test
    void shouldWrapTransportFailure() {
        OkHttpClient client = new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    throw new IOException("connection refused");
                })
                .build();
        ExternalProviderEmbeddingService service =
                new ExternalProviderEmbeddingService(client, "http://embeddings.test/v1", "acme", null, 3);

        EmbeddingException error = assertThrows(EmbeddingException.class, () -> service.embed("hello"));
        assertTrue(error.getMessage().contains("connection refused"));
    }

    static OkHttpClient fakeClient(int code, String json, AtomicReference<Request> seen) {
        return new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    seen.set(chain.request());
                    return new Response.Builder()
                            .request(chain.request())
                            .protocol(Protocol.HTTP_1_1)
                            .code(code)
                            .message(code == 200 ? "OK" : "Error")
                            .body(ResponseBody.create(json, MediaType.get("application/json")))
                            .build();
                })
                .build();
    }
}
