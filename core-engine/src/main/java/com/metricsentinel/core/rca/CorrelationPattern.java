package com.metricsentinel.core.rca;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A set of metrics that are expected to move together.
 *
 * @since 1.0.0
 */
public class CorrelationPattern {

    private String name;
    private List<String> metrics = new ArrayList<>();
    private String expectedCorrelation = "positive";
    private int lagMinutes;

    public CorrelationPattern() {
    }

    public CorrelationPattern(String name, List<String> metrics, String expectedCorrelation) {
        this.name = name;
        setMetrics(metrics);
        this.expectedCorrelation = expectedCorrelation;
    }

    /**
     * @throws IllegalStateException if the pattern is incomplete
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("Correlation 'name' is required");
        }
        if (metrics.size() < 2) {
            errors.add("Correlation '" + name + "' requires at least 2 metrics");
        }
        String sign = expectedCorrelation == null ? "" : expectedCorrelation.toLowerCase(Locale.ROOT);
        if (!sign.equals("positive") && !sign.equals("negative")) {
            errors.add("Correlation '" + name + "' has invalid expectedCorrelation '" + expectedCorrelation + "'");
        }
        if (lagMinutes < 0) {
            errors.add("Correlation '" + name + "' requires 'lagMinutes' >= 0");
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    public boolean involves(String metricName) {
        return metrics.contains(metricName);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getMetrics() {
        return Collections.unmodifiableList(metrics);
    }

    public void setMetrics(List<String> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    public String getExpectedCorrelation() {
        return expectedCorrelation;
    }

    public void setExpectedCorrelation(String expectedCorrelation) {
        this.expectedCorrelation = expectedCorrelation;
    }

    public int getLagMinutes() {
        return lagMinutes;
    }

    public void setLagMinutes(int lagMinutes) {
        this.lagMinutes = lagMinutes;
    }

    @Override
    public String toString() {
        return "CorrelationPattern{name='" + name + "', metrics=" + metrics
                + ", expectedCorrelation=" + expectedCorrelation + '}';
    }
}
