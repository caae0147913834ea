package com.metricsentinel.core.detection;

import java.util.Locale;

/**
 * Identifiers of the scoring algorithms that take part in the ensemble vote.
 *
 * @since 1.0.0
 */
public enum AlgorithmKind {
    ZSCORE("zscore"),
    MAD("mad"),
    ISOLATION_FOREST("isolation_forest");

    private final String id;

    AlgorithmKind(String id) {
        this.id = id;
    }

    /**
     * @return configuration identifier, also recorded in
     *         {@link com.metricsentinel.core.model.AnomalyScore#getAlgorithm()}
     */
    public String id() {
        return id;
    }

    /**
     * @param id configuration identifier, case-insensitive
     * @return the matching kind
     * @throws IllegalArgumentException if {@code id} is unknown
     */
    public static AlgorithmKind fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (AlgorithmKind kind : values()) {
                if (kind.id.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new IllegalArgumentException("Unknown algorithm: '" + id
                + "'. Supported: zscore, mad, isolation_forest");
    }
}
