package com.librarian.store;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    public static final String URL_ENV = "LIBRARIAN_EMBEDDING_URL";
    public static final String PROVIDER_ENV = "LIBRARIAN_EMBEDDING_PROVIDER";
    public static final String API_KEY_ENV = "LIBRARIAN_EMBEDDING_API_KEY";

    private static final Logger log = LoggerFactory.getLogger(EmbeddingServices.class);

    private EmbeddingServices() {
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient, int dimension) {
        return fromEnvironment(httpClient, dimension, System.getenv());
    }

    static EmbeddingService fromEnvironment(OkHttpClient httpClient, int dimension, Map<String, String> environment) {
        String endpoint = environment.get(URL_ENV);
        if (endpoint == null || endpoint.isBlank()) {
            return new LocalEmbeddingService(dimension);
        }
        String provider = environment.getOrDefault(PROVIDER_ENV, "custom");
        log.info("Embedding through {} provider at {}", provider, endpoint);
        return new ExternalProviderEmbeddingService(httpClient, endpoint, provider, environment.get(API_KEY_ENV), dimension);
    }
}
