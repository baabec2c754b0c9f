package com.librarian.store;

import java.io.IOException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Embeds through an HTTP endpoint that answers {@code {"input": text}} with {@code {"embedding": [...]}}.
 * <p>
 * Failures are never papered over with another embedding: vectors from two spaces in one store make every
 * distance meaningless. A failed call or a vector of the wrong dimension raises {@link EmbeddingException}, which
 * fails the current book only.
 */
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final Logger log = LoggerFactory.getLogger(ExternalProviderEmbeddingService.class);
    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String provider;
    private final String apiKey;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String provider,
            String apiKey,
            int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.provider = provider;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            return new float[dimension];
        }
        try (Response response = httpClient.newCall(request(text)).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new EmbeddingException("Embedding endpoint " + endpoint + " answered HTTP " + response.code());
            }
            return vectorFrom(mapper.readTree(body.string()));
        } catch (IOException e) {
            log.warn("Embedding request to {} failed: {}", endpoint, e.getMessage());
            throw new EmbeddingException("Embedding request to " + endpoint + " failed", e);
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

    private Request request(String text) throws IOException {
        Request.Builder builder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(mapper.writeValueAsString(Map.of("input", text)), JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    private float[] vectorFrom(JsonNode root) {
        JsonNode values = root.path("embedding");
        if (!values.isArray()) {
            throw new EmbeddingException("Embedding endpoint " + endpoint + " returned no embedding array");
        }
        if (values.size() != dimension) {
            throw new EmbeddingException("Embedding endpoint " + endpoint + " returned " + values.size()
                    + " values, store expects " + dimension);
        }
        float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = (float) values.get(i).asDouble();
        }
        return vector;
    }
}
