package com.metricsentinel.core.model;

import java.util.Locale;

/**
 * Business area a metric belongs to. Drives severity weighting.
 *
 * @since 1.0.0
 */
public enum MetricCategory {
    TRADING,
    MATCHING,
    RISK,
    WALLET,
    API,
    INFRASTRUCTURE,
    DATABASE,
    QUEUE,
    BUSINESS;

    /**
     * @return lowercase label used in prompts and log output
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
