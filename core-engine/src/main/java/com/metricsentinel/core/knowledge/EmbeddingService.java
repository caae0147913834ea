package com.metricsentinel.core.knowledge;

import java.io.IOException;

/**
 * Turns text into a fixed-dimension vector for similarity search.
 * <p>
 * Implementations own their call timeouts.
 * </p>
 */
public interface EmbeddingService {

    /**
     * @throws IOException if the embedding cannot be produced
     */
    double[] embed(String text) throws IOException;

    int dimensions();
}
