package com.metricsentinel.core.rca;

import com.fasterxml.jackson.databind.JsonNode;
import com.metricsentinel.core.config.SentinelConfig;
import com.metricsentinel.core.http.JsonHttpSender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link LlmClient} for the Anthropic Messages API.
 *
 * <p>
 * Sends {@code POST {baseUrl}/v1/messages} with a single user message and
 * returns the text of the first content block. Transport errors, non-2xx
 * responses and responses without a text block are logged and yield
 * {@link Optional#empty()}.
 * </p>
 *
 * @since 1.0.0
 */
public class AnthropicLlmClient implements LlmClient {

    private static final Logger LOG = LoggerFactory.getLogger(AnthropicLlmClient.class);

    static final String API_VERSION = "2023-06-01";

    private final JsonHttpSender sender;
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    public AnthropicLlmClient(JsonHttpSender sender, String baseUrl, String apiKey, String model, int maxTokens) {
        this.sender = Objects.requireNonNull(sender, "JsonHttpSender must not be null");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.maxTokens = maxTokens;
    }

    public static AnthropicLlmClient fromConfig(SentinelConfig config) {
        return new AnthropicLlmClient(JsonHttpSender.withTimeout(config.getCollaboratorTimeoutMs()),
                config.getLlmBaseUrl(), config.getLlmApiKey(), config.getLlmModel(), config.getLlmMaxTokens());
    }

    @Override
    public Optional<String> complete(String prompt) {
        Map<String, Object> body = Map.of(
                "model", model,
                "max_tokens", maxTokens,
                "messages", List.of(Map.of("role", "user", "content", prompt)));
        try {
            JsonNode response = sender.post(baseUrl + "/v1/messages", body, Map.of(
                    "x-api-key", apiKey,
                    "anthropic-version", API_VERSION));
            JsonNode text = response.path("content").path(0).path("text");
            if (!text.isTextual()) {
                LOG.warn("LLM response has no text content – ignoring: model={}", model);
                return Optional.empty();
            }
            return Optional.of(text.asText());
        } catch (IOException | RuntimeException e) {
            LOG.warn("LLM completion failed: model={} error={}", model, e.toString());
            return Optional.empty();
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
