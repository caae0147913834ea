package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.Baseline;

import java.util.Map;
import java.util.Optional;

/**
 * Source of seasonal baselines, normally backed by a baseline engine.
 * <p>
 * Implementations own their call timeouts. A failure may surface as a
 * {@link RuntimeException}; the detector treats it as a missing baseline.
 * </p>
 */
public interface BaselineProvider {

    /**
     * @return the baseline for the metric and labels, or empty if none exists
     */
    Optional<Baseline> getBaseline(String metricName, Map<String, String> labels);
}
