package com.metricsentinel.core.config;

import com.metricsentinel.core.model.AnomalySeverity;
import com.metricsentinel.core.rca.RcaRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RcaRulesLoader}.
 */
class RcaRulesLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load test rules from classpath")
    void shouldLoadFromClasspath() {
        RcaRulesConfig config = RcaRulesLoader.fromClasspath("test-rca-rules.yml");

        assertThat(config.getRules()).hasSize(2);
        RcaRule dbPool = config.getRules().get(0);
        assertThat(dbPool.getId()).isEqualTo("db-pool");
        assertThat(dbPool.getSeverityLevel()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(dbPool.getCondition().getPrimaryMetric()).isEqualTo("api_latency_p99");
        assertThat(dbPool.getCondition().getCorrelatedMetrics()).hasSize(1);
        assertThat(dbPool.getCondition().getCorrelatedMetrics().get(0).getCorrelation()).isEqualTo("positive");
        assertThat(dbPool.getCondition().getLogPatterns()).containsExactly("timeout", "connection refused");
        assertThat(dbPool.getRemediation()).hasSize(2);
        assertThat(config.getRules().get(1).getCondition().getEventTypes()).containsExactly("OOMKilled");

        assertThat(config.getCorrelations()).hasSize(1);
        assertThat(config.getCorrelations().get(0).getLagMinutes()).isZero();
    }

    @Test
    @DisplayName("Should parse and validate the bundled default rules")
    void shouldLoadBundledDefaults() {
        RcaRulesConfig config = RcaRulesLoader.load(null);

        assertThat(config.getRules()).isNotEmpty();
        assertThat(config.getCorrelations()).isNotEmpty();
    }

    @Test
    @DisplayName("Should fall back to the bundled rules when the file is missing")
    void shouldFallBackWhenPathMissing() {
        RcaRulesConfig config = RcaRulesLoader.load(tempDir.resolve("absent.yml").toString());

        assertThat(config.getRules()).isNotEmpty();
    }

    @Test
    @DisplayName("Should load rules from an explicit file")
    void shouldLoadFromFile() throws IOException {
        Path file = tempDir.resolve("rules.yml");
        Files.writeString(file, """
                rules:
                  - id: only
                    name: Only rule
                    rootCause: Something broke
                    severity: low
                """);

        RcaRulesConfig config = RcaRulesLoader.load(file.toString());

        assertThat(config.getRules()).extracting(RcaRule::getId).containsExactly("only");
        assertThat(config.getCorrelations()).isEmpty();
    }

    @Test
    @DisplayName("Should yield an empty rule set for an empty document")
    void shouldAcceptEmptyDocument() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        RcaRulesConfig config = RcaRulesLoader.fromFile(file.toString());

        assertThat(config.getRules()).isEmpty();
    }

    @Test
    @DisplayName("Should report duplicate ids and bad severities together")
    void shouldFailValidation() {
        assertThatThrownBy(() -> RcaRulesLoader.fromClasspath("invalid-rca-rules.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate rule id 'dup'")
                .hasMessageContaining("catastrophic");
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys() throws IOException {
        Path file = tempDir.resolve("dup-keys.yml");
        Files.writeString(file, """
                rules:
                  - id: a
                    id: b
                    name: Rule
                    rootCause: Cause
                """);

        assertThatThrownBy(() -> RcaRulesLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> RcaRulesLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
