package com.metricsentinel.core.knowledge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PseudoEmbeddingService}.
 */
class PseudoEmbeddingServiceTest {

    @Test
    @DisplayName("Should produce identical vectors of the configured size for identical text")
    void deterministic() {
        PseudoEmbeddingService service = new PseudoEmbeddingService(16);

        double[] first = service.embed("connection pool exhausted");
        double[] second = new PseudoEmbeddingService(16).embed("connection pool exhausted");

        assertThat(first).hasSize(16).containsExactly(second);
        assertThat(service.dimensions()).isEqualTo(16);
    }

    @Test
    @DisplayName("Should produce different vectors for different text")
    void distinctText() {
        PseudoEmbeddingService service = new PseudoEmbeddingService(8);

        assertThat(service.embed("disk full")).isNotEqualTo(service.embed("memory leak"));
    }

    @Test
    @DisplayName("Should reject non-positive dimensions")
    void rejectsBadDimensions() {
        assertThatThrownBy(() -> new PseudoEmbeddingService(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dimensions");
    }
}
