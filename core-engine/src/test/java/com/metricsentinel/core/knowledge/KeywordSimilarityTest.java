package com.metricsentinel.core.knowledge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link KeywordSimilarity}.
 */
class KeywordSimilarityTest {

    @Test
    @DisplayName("Should score the fraction of query words found in the text")
    void queryCoverage() {
        assertThat(KeywordSimilarity.score("database pool exhausted now", "Database connection POOL exhausted"))
                .isCloseTo(0.75, within(1e-9));
    }

    @Test
    @DisplayName("Should ignore repeated words and surrounding whitespace")
    void wordSets() {
        assertThat(KeywordSimilarity.words("  disk  Disk\tfull \n")).containsExactlyInAnyOrder("disk", "full");
        assertThat(KeywordSimilarity.score("disk disk full", "the disk is full")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should score zero for an empty query or an empty text")
    void emptyInputs() {
        assertThat(KeywordSimilarity.score("", "anything at all")).isZero();
        assertThat(KeywordSimilarity.score("memory leak", null)).isZero();
        assertThat(KeywordSimilarity.words(null)).isEmpty();
    }
}
