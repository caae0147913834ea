package com.metricsentinel.core.model;

/**
 * Shape of a detected anomaly.
 *
 * @since 1.0.0
 */
public enum AnomalyType {
    /** Isolated deviation of the latest value. */
    POINT,
    /** Sustained monotonic movement over the most recent values. */
    TREND
}
