package com.metricsentinel.core.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Sends JSON requests to an HTTP collaborator and parses the JSON response.
 *
 * <p>
 * Stateless apart from the underlying {@link OkHttpClient}; one instance may
 * be shared by several clients. Every failure (transport error, timeout,
 * non-2xx status, unparseable body) surfaces as an {@link IOException} so
 * callers can take a single fallback path.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonHttpSender {

    private static final Logger LOG = LoggerFactory.getLogger(JsonHttpSender.class);

    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public JsonHttpSender(OkHttpClient client) {
        this.client = Objects.requireNonNull(client, "OkHttpClient must not be null");
        this.mapper = JsonMapperProvider.get();
    }

    /**
     * @param timeoutMs bound for the whole call, connect to last byte
     * @return a sender whose calls time out after {@code timeoutMs}
     */
    public static JsonHttpSender withTimeout(long timeoutMs) {
        Duration timeout = Duration.ofMillis(timeoutMs);
        return new JsonHttpSender(new OkHttpClient.Builder()
                .callTimeout(timeout)
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build());
    }

    /**
     * @param method  HTTP method, e.g. {@code POST}
     * @param url     absolute URL
     * @param body    object serialized as the JSON body, {@code null} for none
     * @param headers extra request headers
     * @return the parsed response body, an empty object node when the body is empty
     * @throws HttpStatusException on a non-2xx status
     * @throws IOException         on transport failure or an unparseable body
     */
    public JsonNode send(String method, String url, Object body, Map<String, String> headers) throws IOException {
        RequestBody requestBody = body != null
                ? RequestBody.create(mapper.writeValueAsBytes(body), JSON)
                : null;
        Request.Builder builder = new Request.Builder().url(url).method(method, requestBody);
        headers.forEach(builder::header);

        LOG.debug("Sending {} {}", method, url);
        try (Response response = client.newCall(builder.build()).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new HttpStatusException(method, url, response.code(), response.message());
            }
            return text.isBlank() ? mapper.createObjectNode() : mapper.readTree(text);
        }
    }

    public JsonNode post(String url, Object body, Map<String, String> headers) throws IOException {
        return send("POST", url, body, headers);
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
