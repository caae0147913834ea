package com.metricsentinel.core.http;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared, lazily created {@link ObjectMapper} for collaborator payloads and
 * log/event records.
 *
 * @since 1.0.0
 */
public final class JsonMapperProvider {

    private static volatile ObjectMapper objectMapper;

    private JsonMapperProvider() {
        // utility class
    }

    public static ObjectMapper get() {
        ObjectMapper result = objectMapper;
        if (result == null) {
            synchronized (JsonMapperProvider.class) {
                result = objectMapper;
                if (result == null) {
                    result = new ObjectMapper()
                            .registerModule(new JavaTimeModule())
                            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                            .setSerializationInclusion(Include.NON_NULL);
                    objectMapper = result;
                }
            }
        }
        return result;
    }
}
