package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.SentinelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Factory that creates {@link ScoringAlgorithm} instances from
 * {@link SentinelConfig}.
 *
 * <p>
 * This is the single point of extension when adding an ensemble member:
 * add an {@link AlgorithmKind} constant and map it here.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlgorithmFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AlgorithmFactory.class);

    private AlgorithmFactory() {
        // utility class
    }

    /**
     * Create the algorithm for {@code kind}, using the thresholds in {@code config}.
     *
     * @throws NullPointerException if an argument is {@code null}
     */
    public static ScoringAlgorithm create(AlgorithmKind kind, SentinelConfig config) {
        Objects.requireNonNull(kind, "AlgorithmKind must not be null");
        Objects.requireNonNull(config, "SentinelConfig must not be null");

        return switch (kind) {
            case ZSCORE -> new ZScoreAlgorithm(config.getZscoreThreshold());
            case MAD -> new MadAlgorithm(config.getMadThreshold());
            case ISOLATION_FOREST -> new IsolationForestAlgorithm();
        };
    }

    /**
     * Create the dispatch table for every enabled algorithm.
     *
     * <p>
     * The returned map is <strong>unmodifiable</strong> and iterates in
     * {@link AlgorithmKind} declaration order.
     * </p>
     */
    public static Map<AlgorithmKind, ScoringAlgorithm> createAll(SentinelConfig config) {
        Objects.requireNonNull(config, "SentinelConfig must not be null");
        Map<AlgorithmKind, ScoringAlgorithm> table = new EnumMap<>(AlgorithmKind.class);
        for (AlgorithmKind kind : config.getAlgorithms()) {
            table.put(kind, create(kind, config));
        }
        LOG.info("Enabled {} scoring algorithm(s): {}", table.size(), table.keySet());
        return Collections.unmodifiableMap(table);
    }
}
