package com.metricsentinel.core.knowledge;

import com.fasterxml.jackson.databind.JsonNode;
import com.metricsentinel.core.http.HttpStatusException;
import com.metricsentinel.core.http.JsonHttpSender;
import com.metricsentinel.core.http.JsonMapperProvider;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link QdrantVectorIndex} against a mock Qdrant REST API.
 */
class QdrantVectorIndexTest {

    private MockWebServer server;
    private QdrantVectorIndex index;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        index = new QdrantVectorIndex(JsonHttpSender.withTimeout(1_000), server.url("/").toString(), "kb");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Should create the collection with cosine distance when it does not exist")
    void createsMissingCollection() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setBody("{\"result\":true,\"status\":\"ok\"}"));

        index.ensureCollection(384);

        RecordedRequest lookup = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(lookup.getMethod()).isEqualTo("GET");
        assertThat(lookup.getPath()).isEqualTo("/collections/kb");

        RecordedRequest create = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(create.getMethod()).isEqualTo("PUT");
        assertThat(create.getPath()).isEqualTo("/collections/kb");
        JsonNode body = readBody(create);
        assertThat(body.at("/vectors/size").asInt()).isEqualTo(384);
        assertThat(body.at("/vectors/distance").asText()).isEqualTo("Cosine");
    }

    @Test
    @DisplayName("Should leave an existing collection alone")
    void existingCollection() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"result\":{\"status\":\"green\"}}"));

        index.ensureCollection(384);

        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should propagate errors other than a missing collection")
    void serverError() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> index.ensureCollection(384))
                .isInstanceOf(HttpStatusException.class)
                .hasMessageContaining("503");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should upsert under a stable name-based point id")
    void upsert() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"result\":{\"status\":\"completed\"}}"));

        index.upsert("INC-1234abcd", new double[] {0.1, 0.2}, Map.of("type", "incident", "id", "INC-1234abcd"));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getPath()).isEqualTo("/collections/kb/points?wait=true");
        JsonNode point = readBody(request).at("/points/0");
        assertThat(point.get("id").asText()).isEqualTo(QdrantVectorIndex.pointId("INC-1234abcd"));
        assertThat(point.at("/vector/1").asDouble()).isEqualTo(0.2);
        assertThat(point.at("/payload/type").asText()).isEqualTo("incident");
    }

    @Test
    @DisplayName("Should derive the same point id for the same item id")
    void pointIdIsStable() {
        assertThat(QdrantVectorIndex.pointId("RB-1"))
                .isEqualTo(QdrantVectorIndex.pointId("RB-1"))
                .isNotEqualTo(QdrantVectorIndex.pointId("RB-2"))
                .matches("[0-9a-f]{8}-[0-9a-f]{4}-3[0-9a-f]{3}-[0-9a-f]{4}-[0-9a-f]{12}");
    }

    @Test
    @DisplayName("Should filter the search by item type and return scored payloads")
    void search() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"result": [
                  {"id": "a", "score": 0.91, "payload": {"type": "runbook", "id": "RB-1", "title": "Scale pool"}},
                  {"id": "b", "score": 0.55, "payload": {"type": "runbook", "id": "RB-2", "title": "Restart"}}
                ]}
                """));

        List<VectorMatch> matches = index.search(new double[] {1.0, 0.0}, ItemType.RUNBOOK, 3);

        assertThat(matches).extracting(VectorMatch::getScore).containsExactly(0.91, 0.55);
        assertThat(matches.get(0).getPayload()).containsEntry("id", "RB-1").containsEntry("title", "Scale pool");

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/collections/kb/points/search");
        JsonNode body = readBody(request);
        assertThat(body.get("limit").asInt()).isEqualTo(3);
        assertThat(body.get("with_payload").asBoolean()).isTrue();
        assertThat(body.at("/filter/must/0/key").asText()).isEqualTo("type");
        assertThat(body.at("/filter/must/0/match/value").asText()).isEqualTo("runbook");
    }

    @Test
    @DisplayName("Should reject a search response without a result array")
    void malformedResponse() {
        server.enqueue(new MockResponse().setBody("{\"status\":\"ok\"}"));

        assertThatThrownBy(() -> index.search(new double[] {1.0}, ItemType.INCIDENT, 5))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("result");
    }

    @Test
    @DisplayName("Should reject a hit without a numeric score")
    void malformedHit() {
        server.enqueue(new MockResponse().setBody("{\"result\":[{\"score\":\"high\",\"payload\":{}}]}"));

        assertThatThrownBy(() -> index.search(new double[] {1.0}, ItemType.INCIDENT, 5))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("hit");
    }

    private static JsonNode readBody(RecordedRequest request) throws IOException {
        return JsonMapperProvider.get().readTree(request.getBody().readUtf8());
    }
}
