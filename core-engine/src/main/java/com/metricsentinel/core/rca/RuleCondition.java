package com.metricsentinel.core.rca;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Trigger conditions of an {@link RcaRule}. Every part is optional; a rule
 * scores only on the parts it declares.
 *
 * @since 1.0.0
 */
public class RuleCondition {

    private String primaryMetric = "";
    private double primaryThreshold;
    private List<CorrelatedMetric> correlatedMetrics = new ArrayList<>();
    private List<String> logPatterns = new ArrayList<>();
    private String eventType;

    public String getPrimaryMetric() {
        return primaryMetric;
    }

    public void setPrimaryMetric(String primaryMetric) {
        this.primaryMetric = primaryMetric != null ? primaryMetric : "";
    }

    public double getPrimaryThreshold() {
        return primaryThreshold;
    }

    public void setPrimaryThreshold(double primaryThreshold) {
        this.primaryThreshold = primaryThreshold;
    }

    public List<CorrelatedMetric> getCorrelatedMetrics() {
        return Collections.unmodifiableList(correlatedMetrics);
    }

    public void setCorrelatedMetrics(List<CorrelatedMetric> correlatedMetrics) {
        this.correlatedMetrics = correlatedMetrics != null ? new ArrayList<>(correlatedMetrics) : new ArrayList<>();
    }

    public List<String> getLogPatterns() {
        return Collections.unmodifiableList(logPatterns);
    }

    public void setLogPatterns(List<String> logPatterns) {
        this.logPatterns = logPatterns != null ? new ArrayList<>(logPatterns) : new ArrayList<>();
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    /**
     * @return the declared event type as a list, empty when none is declared
     */
    public List<String> getEventTypes() {
        return eventType == null || eventType.isBlank() ? List.of() : List.of(eventType);
    }

    @Override
    public String toString() {
        return "RuleCondition{" +
                "primaryMetric='" + primaryMetric + '\'' +
                ", primaryThreshold=" + primaryThreshold +
                ", correlatedMetrics=" + correlatedMetrics +
                ", logPatterns=" + logPatterns +
                ", eventType='" + eventType + '\'' +
                '}';
    }
}
