package com.metricsentinel.core.knowledge;

import com.fasterxml.jackson.databind.JsonNode;
import com.metricsentinel.core.config.SentinelConfig;
import com.metricsentinel.core.http.JsonHttpSender;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;

/**
 * {@link EmbeddingService} for an OpenAI-compatible {@code /v1/embeddings}
 * endpoint.
 *
 * @since 1.0.0
 */
public class HttpEmbeddingService implements EmbeddingService {

    private final JsonHttpSender sender;
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int dimensions;

    public HttpEmbeddingService(JsonHttpSender sender, String baseUrl, String apiKey, String model, int dimensions) {
        this.sender = Objects.requireNonNull(sender, "JsonHttpSender must not be null");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null").replaceAll("/+$", "");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        if (dimensions < 1) {
            throw new IllegalArgumentException("dimensions must be >= 1, got: " + dimensions);
        }
        this.dimensions = dimensions;
    }

    public static HttpEmbeddingService fromConfig(SentinelConfig config) {
        return new HttpEmbeddingService(JsonHttpSender.withTimeout(config.getCollaboratorTimeoutMs()),
                config.getEmbeddingUrl(), config.getEmbeddingApiKey(), config.getEmbeddingModel(),
                config.getEmbeddingDimensions());
    }

    /**
     * @throws IOException on transport failure, a non-2xx status, or a response
     *                     without an embedding of the expected dimension
     */
    @Override
    public double[] embed(String text) throws IOException {
        JsonNode response = sender.post(baseUrl + "/v1/embeddings",
                Map.of("model", model, "input", text, "dimensions", dimensions),
                Map.of("Authorization", "Bearer " + apiKey));

        JsonNode embedding = response.path("data").path(0).path("embedding");
        if (!embedding.isArray() || embedding.size() != dimensions) {
            throw new IOException("Malformed embedding response: expected " + dimensions
                    + " dimensions, got " + (embedding.isArray() ? embedding.size() : "none"));
        }
        double[] vector = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            JsonNode value = embedding.get(i);
            if (!value.isNumber()) {
                throw new IOException("Malformed embedding response: non-numeric value at index " + i);
            }
            vector[i] = value.doubleValue();
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }
}
