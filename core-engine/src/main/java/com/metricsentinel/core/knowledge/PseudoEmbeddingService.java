package com.metricsentinel.core.knowledge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Random;

/**
 * Offline stand-in for a real embedding model.
 *
 * <p>
 * <strong>Not semantic.</strong> The vector is a Gaussian sequence seeded from
 * the SHA-256 digest of the text: identical texts map to identical vectors,
 * but similar texts do not map to similar vectors. Only wired when offline
 * embeddings are explicitly enabled, for tests and air-gapped demos.
 * </p>
 *
 * @since 1.0.0
 */
public class PseudoEmbeddingService implements EmbeddingService {

    private static final Logger LOG = LoggerFactory.getLogger(PseudoEmbeddingService.class);

    private final int dimensions;

    public PseudoEmbeddingService(int dimensions) {
        if (dimensions < 1) {
            throw new IllegalArgumentException("dimensions must be >= 1, got: " + dimensions);
        }
        this.dimensions = dimensions;
        LOG.warn("Offline pseudo-embeddings enabled: dimensions={} – similarity search results are not semantic",
                dimensions);
    }

    @Override
    public double[] embed(String text) {
        Random random = new Random(seedOf(text));
        double[] vector = new double[dimensions];
        for (int i = 0; i < dimensions; i++) {
            vector[i] = random.nextGaussian();
        }
        return vector;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private static long seedOf(String text) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest((text != null ? text : "").getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
