package com.metricsentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Verdict of one scoring algorithm for one detection attempt. Immutable.
 *
 * @since 1.0.0
 */
public final class AnomalyScore {

    private final String algorithm;
    private final double score;
    private final double threshold;
    private final boolean anomaly;
    private final Map<String, Double> details;

    /**
     * @param algorithm algorithm identifier, e.g. {@code zscore}
     * @param score     normalised score in [0, 1], higher is more anomalous
     * @param threshold the algorithm's decision threshold
     * @param anomaly   whether the algorithm votes for an anomaly
     * @param details   algorithm-specific diagnostic values, may be {@code null}
     */
    public AnomalyScore(String algorithm, double score, double threshold, boolean anomaly,
            Map<String, Double> details) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm must not be null");
        this.score = score;
        this.threshold = threshold;
        this.anomaly = anomaly;
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Collections.emptyMap();
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public double getScore() {
        return score;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public Map<String, Double> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return "AnomalyScore{" +
                "algorithm='" + algorithm + '\'' +
                ", score=" + score +
                ", threshold=" + threshold +
                ", anomaly=" + anomaly +
                ", details=" + details +
                '}';
    }
}
