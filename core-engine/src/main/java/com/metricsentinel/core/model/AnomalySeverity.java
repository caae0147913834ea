package com.metricsentinel.core.model;

import java.util.Locale;

/**
 * Severity of a detected anomaly or of an RCA rule, ordered from least to most
 * severe.
 *
 * @since 1.0.0
 */
public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a case-insensitive severity label such as {@code "high"}.
     *
     * @param label severity label; must not be {@code null}
     * @return the matching severity
     * @throws IllegalArgumentException if the label is unknown
     */
    public static AnomalySeverity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Severity label must not be blank");
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + label
                    + "'. Supported: low, medium, high, critical", e);
        }
    }
}
