package com.metricsentinel.core.rca;

import com.fasterxml.jackson.databind.JsonNode;
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
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnthropicLlmClient} against a mock Messages API.
 */
class AnthropicLlmClientTest {

    private MockWebServer server;
    private AnthropicLlmClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new AnthropicLlmClient(JsonHttpSender.withTimeout(1_000), server.url("/").toString(),
                "sk-test", "claude-test", 300);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    @DisplayName("Should post the prompt and return the first text block")
    void shouldReturnText() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"content\":[{\"type\":\"text\",\"text\":\"Likely pool exhaustion.\"}]}"));

        Optional<String> answer = client.complete("What happened?");

        assertThat(answer).contains("Likely pool exhaustion.");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/v1/messages");
        assertThat(request.getHeader("x-api-key")).isEqualTo("sk-test");
        assertThat(request.getHeader("anthropic-version")).isEqualTo(AnthropicLlmClient.API_VERSION);

        JsonNode body = JsonMapperProvider.get().readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("claude-test");
        assertThat(body.path("max_tokens").asInt()).isEqualTo(300);
        assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("user");
        assertThat(body.path("messages").path(0).path("content").asText()).isEqualTo("What happened?");
    }

    @Test
    @DisplayName("Should yield no analysis for non-2xx responses")
    void shouldReturnEmptyOnServerError() {
        server.enqueue(new MockResponse().setResponseCode(529).setBody("{\"error\":\"overloaded\"}"));

        assertThat(client.complete("What happened?")).isEmpty();
    }

    @Test
    @DisplayName("Should yield no analysis for responses without a text block")
    void shouldReturnEmptyWithoutText() {
        server.enqueue(new MockResponse().setBody("{\"content\":[{\"type\":\"tool_use\",\"id\":\"x\"}]}"));

        assertThat(client.complete("What happened?")).isEmpty();
    }

    @Test
    @DisplayName("Should yield no analysis when the response is slower than the timeout")
    void shouldReturnEmptyOnTimeout() {
        server.enqueue(new MockResponse()
                .setBody("{\"content\":[{\"type\":\"text\",\"text\":\"late\"}]}")
                .setHeadersDelay(3, TimeUnit.SECONDS));

        assertThat(client.complete("What happened?")).isEmpty();
    }
}
