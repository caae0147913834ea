package com.metricsentinel.core.knowledge;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Similarity index over knowledge-item embeddings.
 * <p>
 * Implementations own their call timeouts and report every failure,
 * including a malformed response, as an {@link IOException}.
 * </p>
 */
public interface VectorIndex {

    /**
     * Create the backing collection if it does not exist yet.
     */
    void ensureCollection(int dimensions) throws IOException;

    /**
     * Insert or replace the vector stored for {@code itemId}.
     */
    void upsert(String itemId, double[] vector, Map<String, Object> payload) throws IOException;

    /**
     * @return up to {@code limit} matches of {@code type}, closest first
     */
    List<VectorMatch> search(double[] vector, ItemType type, int limit) throws IOException;
}
