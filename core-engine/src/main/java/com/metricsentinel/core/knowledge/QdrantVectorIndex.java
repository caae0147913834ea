package com.metricsentinel.core.knowledge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.metricsentinel.core.config.SentinelConfig;
import com.metricsentinel.core.http.HttpStatusException;
import com.metricsentinel.core.http.JsonHttpSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link VectorIndex} backed by the Qdrant REST API.
 *
 * <p>
 * Items share one collection and are told apart by the {@code type} payload
 * field. Point ids are name-based UUIDs of the item id, so re-adding an item
 * replaces its point.
 * </p>
 *
 * @since 1.0.0
 */
public class QdrantVectorIndex implements VectorIndex {

    private static final Logger LOG = LoggerFactory.getLogger(QdrantVectorIndex.class);

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final JsonHttpSender sender;
    private final String baseUrl;
    private final String collection;

    public QdrantVectorIndex(JsonHttpSender sender, String baseUrl, String collection) {
        this.sender = Objects.requireNonNull(sender, "JsonHttpSender must not be null");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null").replaceAll("/+$", "");
        this.collection = Objects.requireNonNull(collection, "collection must not be null");
    }

    public static QdrantVectorIndex fromConfig(SentinelConfig config) {
        return new QdrantVectorIndex(JsonHttpSender.withTimeout(config.getCollaboratorTimeoutMs()),
                config.getQdrantUrl(), config.getQdrantCollection());
    }

    @Override
    public void ensureCollection(int dimensions) throws IOException {
        String url = collectionUrl();
        try {
            sender.send("GET", url, null, Map.of());
            LOG.debug("Qdrant collection exists: collection={}", collection);
        } catch (HttpStatusException e) {
            if (e.getStatusCode() != 404) {
                throw e;
            }
            sender.send("PUT", url,
                    Map.of("vectors", Map.of("size", dimensions, "distance", "Cosine")), Map.of());
            LOG.info("Created Qdrant collection: collection={} dimensions={}", collection, dimensions);
        }
    }

    @Override
    public void upsert(String itemId, double[] vector, Map<String, Object> payload) throws IOException {
        Map<String, Object> point = Map.of(
                "id", pointId(itemId),
                "vector", vector,
                "payload", payload);
        sender.send("PUT", collectionUrl() + "/points?wait=true", Map.of("points", List.of(point)), Map.of());
    }

    @Override
    public List<VectorMatch> search(double[] vector, ItemType type, int limit) throws IOException {
        Map<String, Object> filter = Map.of("must",
                List.of(Map.of("key", "type", "match", Map.of("value", type.id()))));
        JsonNode response = sender.post(collectionUrl() + "/points/search",
                Map.of("vector", vector, "filter", filter, "limit", limit, "with_payload", true), Map.of());

        JsonNode result = response.get("result");
        if (result == null || !result.isArray()) {
            throw new IOException("Malformed Qdrant search response: missing 'result' array");
        }
        List<VectorMatch> matches = new ArrayList<>(result.size());
        for (JsonNode hit : result) {
            JsonNode score = hit.get("score");
            JsonNode payload = hit.get("payload");
            if (score == null || !score.isNumber() || payload == null || !payload.isObject()) {
                throw new IOException("Malformed Qdrant search hit: " + hit);
            }
            matches.add(new VectorMatch(score.doubleValue(), sender.mapper().convertValue(payload, PAYLOAD_TYPE)));
        }
        return matches;
    }

    static String pointId(String itemId) {
        return UUID.nameUUIDFromBytes(itemId.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private String collectionUrl() {
        return baseUrl + "/collections/" + collection;
    }
}
