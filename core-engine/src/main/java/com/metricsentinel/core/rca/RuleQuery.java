package com.metricsentinel.core.rca;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evidence presented to a {@link RuleEngine} for one anomaly.
 *
 * @since 1.0.0
 */
public final class RuleQuery {

    private final String metricName;
    private final double metricValue;
    private final Map<String, Double> correlatedValues;
    private final List<String> logPatterns;
    private final List<String> eventTypes;

    public RuleQuery(String metricName, double metricValue, Map<String, Double> correlatedValues,
            List<String> logPatterns, List<String> eventTypes) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.metricValue = metricValue;
        this.correlatedValues = correlatedValues != null ? Map.copyOf(correlatedValues) : Map.of();
        this.logPatterns = logPatterns != null ? List.copyOf(logPatterns) : List.of();
        this.eventTypes = eventTypes != null ? List.copyOf(eventTypes) : List.of();
    }

    public String getMetricName() {
        return metricName;
    }

    public double getMetricValue() {
        return metricValue;
    }

    /** @return latest value per related metric name */
    public Map<String, Double> getCorrelatedValues() {
        return correlatedValues;
    }

    public List<String> getLogPatterns() {
        return logPatterns;
    }

    public List<String> getEventTypes() {
        return eventTypes;
    }

    @Override
    public String toString() {
        return "RuleQuery{metric=" + metricName + ", value=" + metricValue
                + ", correlated=" + correlatedValues.keySet() + ", logPatterns=" + logPatterns
                + ", eventTypes=" + eventTypes + '}';
    }
}
