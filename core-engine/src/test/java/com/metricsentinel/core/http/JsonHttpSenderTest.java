package com.metricsentinel.core.http;

import com.fasterxml.jackson.databind.JsonNode;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonHttpSender}.
 */
class JsonHttpSenderTest {

    private MockWebServer server;
    private JsonHttpSender sender;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        sender = JsonHttpSender.withTimeout(1_000);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Should serialize the body as JSON and parse the response")
    void postsJson() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"ok\":true,\"count\":3}"));

        JsonNode response = sender.post(server.url("/things").toString(), Map.of("name", "pool"),
                Map.of("X-Trace", "abc"));

        assertThat(response.get("ok").asBoolean()).isTrue();
        assertThat(response.get("count").asInt()).isEqualTo(3);

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getHeader("X-Trace")).isEqualTo("abc");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"name\":\"pool\"}");
    }

    @Test
    @DisplayName("Should send a GET without a body")
    void getWithoutBody() throws Exception {
        server.enqueue(new MockResponse().setBody("{}"));

        sender.send("GET", server.url("/status").toString(), null, Map.of());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getBodySize()).isZero();
    }

    @Test
    @DisplayName("Should return an empty object for an empty response body")
    void emptyBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200));

        JsonNode response = sender.send("PUT", server.url("/x").toString(), Map.of("a", 1), Map.of());

        assertThat(response.isObject()).isTrue();
        assertThat(response.size()).isZero();
    }

    @Test
    @DisplayName("Should raise HttpStatusException carrying the status code on non-2xx")
    void nonSuccessStatus() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"status\":\"not found\"}"));

        assertThatThrownBy(() -> sender.send("GET", server.url("/missing").toString(), null, Map.of()))
                .isInstanceOf(HttpStatusException.class)
                .hasMessageContaining("404")
                .satisfies(e -> assertThat(((HttpStatusException) e).getStatusCode()).isEqualTo(404));
    }

    @Test
    @DisplayName("Should report an unparseable body as IOException")
    void unparseableBody() {
        server.enqueue(new MockResponse().setBody("not json {"));

        assertThatThrownBy(() -> sender.post(server.url("/x").toString(), Map.of(), Map.of()))
                .isInstanceOf(IOException.class)
                .isNotInstanceOf(HttpStatusException.class);
    }
}
