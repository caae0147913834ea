package com.metricsentinel.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Result of one detection cycle.
 *
 * @since 1.0.0
 */
public final class AnomalyBatch {

    private final Instant detectionTime;
    private final List<Anomaly> anomalies;
    private final List<Anomaly> resolved;
    private final int metricsChecked;
    private final long detectionDurationMs;

    public AnomalyBatch(Instant detectionTime, List<Anomaly> anomalies, List<Anomaly> resolved,
            int metricsChecked, long detectionDurationMs) {
        this.detectionTime = Objects.requireNonNull(detectionTime, "detectionTime must not be null");
        this.anomalies = anomalies != null ? List.copyOf(anomalies) : List.of();
        this.resolved = resolved != null ? List.copyOf(resolved) : List.of();
        this.metricsChecked = metricsChecked;
        this.detectionDurationMs = detectionDurationMs;
    }

    public Instant getDetectionTime() {
        return detectionTime;
    }

    /**
     * @return anomalies detected (new or ongoing) in this cycle
     */
    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    /**
     * @return anomalies that resolved in this cycle
     */
    public List<Anomaly> getResolved() {
        return resolved;
    }

    public int getMetricsChecked() {
        return metricsChecked;
    }

    public long getDetectionDurationMs() {
        return detectionDurationMs;
    }

    public int count() {
        return anomalies.size();
    }

    public long criticalCount() {
        return anomalies.stream().filter(Anomaly::isCritical).count();
    }

    public List<Anomaly> filterBySeverity(AnomalySeverity severity) {
        return anomalies.stream().filter(a -> a.getSeverity() == severity).toList();
    }

    public List<Anomaly> filterByCategory(MetricCategory category) {
        return anomalies.stream().filter(a -> a.getCategory() == category).toList();
    }

    @Override
    public String toString() {
        return "AnomalyBatch{" +
                "detectionTime=" + detectionTime +
                ", anomalies=" + anomalies.size() +
                ", resolved=" + resolved.size() +
                ", metricsChecked=" + metricsChecked +
                ", detectionDurationMs=" + detectionDurationMs +
                '}';
    }
}
