package com.metricsentinel.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * A detected deviation of one metric from its baseline, with the evidence
 * that produced it and the context gathered by root-cause analysis.
 *
 * <h3>Lifecycle</h3>
 * <p>
 * An anomaly is created when the ensemble vote crosses its threshold. While
 * it stays active, later detections for the same metric key refresh the
 * measurement fields in place via {@link #refreshFrom(Anomaly)}, keeping the
 * id, {@code startedAt} and acknowledgement. Resolution marks it inactive.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Mutators are {@code synchronized}; the detector's
 * {@code AnomalyState} is the only writer of lifecycle fields.
 * </p>
 *
 * @since 1.0.0
 */
public class Anomaly {

    private final String id;
    private final String metricName;
    private final MetricCategory category;
    private final Map<String, String> labels;

    private Instant detectedAt;
    private double currentValue;
    private double baselineValue;
    private double deviation;
    private double deviationPercent;
    private AnomalyType type;
    private AnomalySeverity severity;
    private List<AnomalyScore> scores;
    private double ensembleScore;

    private Instant startedAt;
    private long durationMinutes;

    private AnomalyContext context = AnomalyContext.empty();
    private boolean active = true;
    private boolean acknowledged;
    private String acknowledgedBy;
    private Instant resolvedAt;

    private Anomaly(Builder b) {
        this.id = b.id != null ? b.id : newId();
        this.detectedAt = Objects.requireNonNull(b.detectedAt, "detectedAt must not be null");
        this.metricName = Objects.requireNonNull(b.metricName, "metricName must not be null");
        this.category = Objects.requireNonNull(b.category, "category must not be null");
        this.labels = b.labels != null
                ? Collections.unmodifiableMap(new TreeMap<>(b.labels))
                : Collections.emptyMap();
        this.currentValue = b.currentValue;
        this.baselineValue = b.baselineValue;
        this.deviation = b.deviation;
        this.deviationPercent = b.deviationPercent;
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.scores = b.scores != null ? List.copyOf(b.scores) : List.of();
        this.ensembleScore = b.ensembleScore;
        this.startedAt = b.startedAt != null ? b.startedAt : b.detectedAt;
        this.durationMinutes = minutesBetween(this.startedAt, this.detectedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String newId() {
        return "ANO-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    private static long minutesBetween(Instant from, Instant to) {
        return Math.max(0, Duration.between(from, to).toMinutes());
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Copy the measurement fields of a newer detection of the same metric
     * into this anomaly. Identity, {@code startedAt}, acknowledgement and
     * context are kept.
     *
     * @param latest newer detection of the same metric key
     * @throws IllegalArgumentException if {@code latest} is for another metric key
     */
    public synchronized void refreshFrom(Anomaly latest) {
        if (!metricKey().equals(latest.metricKey())) {
            throw new IllegalArgumentException("Cannot refresh " + metricKey() + " from " + latest.metricKey());
        }
        this.detectedAt = latest.detectedAt;
        this.currentValue = latest.currentValue;
        this.baselineValue = latest.baselineValue;
        this.deviation = latest.deviation;
        this.deviationPercent = latest.deviationPercent;
        this.type = latest.type;
        this.severity = latest.severity;
        this.scores = latest.scores;
        this.ensembleScore = latest.ensembleScore;
        updateDuration(latest.detectedAt);
    }

    /**
     * Recompute {@code durationMinutes} as whole minutes from {@code startedAt}
     * to {@code now}.
     */
    public synchronized void updateDuration(Instant now) {
        this.durationMinutes = minutesBetween(startedAt, now);
    }

    public synchronized void acknowledge(String by) {
        this.acknowledged = true;
        this.acknowledgedBy = by;
    }

    public synchronized void resolve(Instant at) {
        updateDuration(at);
        this.active = false;
        this.resolvedAt = at;
    }

    public synchronized void setContext(AnomalyContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    // ---------------------------------------------------------------
    // Derived
    // ---------------------------------------------------------------

    public boolean isCritical() {
        return getSeverity() == AnomalySeverity.CRITICAL;
    }

    public String metricKey() {
        return MetricSeries.metricKey(metricName, labels);
    }

    /**
     * @return one-line operator message, e.g.
     *         {@code [CRITICAL] api_latency is 10.0 sigma above baseline. Current: 20.00, Expected: 10.00 (+100.0%)}
     */
    public synchronized String toAlertMessage() {
        String direction = deviation > 0 ? "above" : "below";
        return String.format(Locale.ROOT,
                "[%s] %s is %.1f sigma %s baseline. Current: %.2f, Expected: %.2f (%+.1f%%)",
                severity.name(), metricName, Math.abs(deviation), direction,
                currentValue, baselineValue, deviationPercent);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public synchronized Instant getDetectedAt() {
        return detectedAt;
    }

    public String getMetricName() {
        return metricName;
    }

    public MetricCategory getCategory() {
        return category;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public synchronized double getCurrentValue() {
        return currentValue;
    }

    public synchronized double getBaselineValue() {
        return baselineValue;
    }

    /**
     * @return signed deviation from the baseline in standard deviations
     */
    public synchronized double getDeviation() {
        return deviation;
    }

    public synchronized double getDeviationPercent() {
        return deviationPercent;
    }

    public synchronized AnomalyType getType() {
        return type;
    }

    public synchronized AnomalySeverity getSeverity() {
        return severity;
    }

    public synchronized List<AnomalyScore> getScores() {
        return scores;
    }

    public synchronized double getEnsembleScore() {
        return ensembleScore;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized long getDurationMinutes() {
        return durationMinutes;
    }

    public synchronized AnomalyContext getContext() {
        return context;
    }

    public synchronized boolean isActive() {
        return active;
    }

    public synchronized boolean isAcknowledged() {
        return acknowledged;
    }

    public synchronized String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    public synchronized Instant getResolvedAt() {
        return resolvedAt;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder. {@code detectedAt}, {@code metricName}, {@code category},
     * {@code type} and {@code severity} are required; {@code startedAt}
     * defaults to {@code detectedAt}.
     */
    public static class Builder {
        private String id;
        private Instant detectedAt;
        private String metricName;
        private MetricCategory category;
        private Map<String, String> labels;
        private double currentValue;
        private double baselineValue;
        private double deviation;
        private double deviationPercent;
        private AnomalyType type = AnomalyType.POINT;
        private AnomalySeverity severity;
        private List<AnomalyScore> scores;
        private double ensembleScore;
        private Instant startedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder category(MetricCategory category) {
            this.category = category;
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder baselineValue(double baselineValue) {
            this.baselineValue = baselineValue;
            return this;
        }

        public Builder deviation(double deviation) {
            this.deviation = deviation;
            return this;
        }

        public Builder deviationPercent(double deviationPercent) {
            this.deviationPercent = deviationPercent;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder severity(AnomalySeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder scores(List<AnomalyScore> scores) {
            this.scores = scores;
            return this;
        }

        public Builder ensembleScore(double ensembleScore) {
            this.ensembleScore = ensembleScore;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        /**
         * @return a new active {@link Anomaly}
         * @throws NullPointerException if a required field is missing
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "id='" + id + '\'' +
                ", key='" + metricKey() + '\'' +
                ", severity=" + getSeverity() +
                ", deviation=" + getDeviation() +
                ", active=" + isActive() +
                '}';
    }
}
