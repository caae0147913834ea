package com.metricsentinel.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One named, labelled time series as supplied by the metric store for a
 * single monitoring cycle.
 *
 * <p>
 * Instances are read-only: data points are copied on construction and kept
 * in the order supplied (oldest first).
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries {

    private final String name;
    private final MetricCategory category;
    private final Map<String, String> labels;
    private final List<DataPoint> dataPoints;
    private final List<Double> values;

    /**
     * @param name       metric name; must not be {@code null}
     * @param category   metric category; must not be {@code null}
     * @param labels     metric labels, may be {@code null} for none
     * @param dataPoints ordered samples, may be {@code null} for none
     */
    public MetricSeries(String name, MetricCategory category, Map<String, String> labels,
            List<DataPoint> dataPoints) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.labels = labels != null
                ? Collections.unmodifiableMap(new TreeMap<>(labels))
                : Collections.emptyMap();
        this.dataPoints = dataPoints != null
                ? List.copyOf(dataPoints)
                : List.of();
        List<Double> copy = new ArrayList<>(this.dataPoints.size());
        for (DataPoint point : this.dataPoints) {
            copy.add(point.getValue());
        }
        this.values = Collections.unmodifiableList(copy);
    }

    public String getName() {
        return name;
    }

    public MetricCategory getCategory() {
        return category;
    }

    /**
     * @return unmodifiable labels, sorted by key
     */
    public Map<String, String> getLabels() {
        return labels;
    }

    public List<DataPoint> getDataPoints() {
        return dataPoints;
    }

    /**
     * @return the sample values in order, oldest first
     */
    public List<Double> getValues() {
        return values;
    }

    /**
     * @return value of the most recent data point, or empty for an empty series
     */
    public Optional<Double> getLatestValue() {
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(values.size() - 1));
    }

    public boolean isEmpty() {
        return dataPoints.isEmpty();
    }

    public int size() {
        return dataPoints.size();
    }

    /**
     * Build the identity key for a metric name and label set:
     * {@code name} when unlabelled, otherwise {@code name{k1=v1,k2=v2}} with keys
     * sorted.
     *
     * @param name   metric name
     * @param labels metric labels, may be {@code null}
     * @return the metric key
     */
    public static String metricKey(String name, Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        boolean first = true;
        for (Map.Entry<String, String> e : new TreeMap<>(labels).entrySet()) {
            if (!first) {
                sb.append(',');
            }
            sb.append(e.getKey()).append('=').append(e.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }

    /**
     * @return the identity key of this series
     * @see #metricKey(String, Map)
     */
    public String metricKey() {
        return metricKey(name, labels);
    }

    @Override
    public String toString() {
        return "MetricSeries{" +
                "key='" + metricKey() + '\'' +
                ", category=" + category +
                ", points=" + dataPoints.size() +
                '}';
    }
}
