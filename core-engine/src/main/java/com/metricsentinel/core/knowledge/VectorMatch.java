package com.metricsentinel.core.knowledge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One hit returned by a {@link VectorIndex} search.
 *
 * @since 1.0.0
 */
public final class VectorMatch {

    private final double score;
    private final Map<String, Object> payload;

    public VectorMatch(double score, Map<String, Object> payload) {
        this.score = score;
        this.payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
    }

    /** @return similarity, higher is closer */
    public double getScore() {
        return score;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "VectorMatch{score=" + score + ", id=" + payload.get("id") + '}';
    }
}
