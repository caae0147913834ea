package com.metricsentinel.core.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Seasonal and statistical expectation for one metric and label set.
 *
 * <p>
 * Baselines are produced by the external baseline engine and are only read
 * here. The expected value for a timestamp comes from the hourly baseline of
 * its UTC hour (scaled by the day-of-week adjustment when present); when no
 * hourly baseline covers the hour the global statistics are used.
 * </p>
 *
 * @since 1.0.0
 */
public final class Baseline {

    private final String metricName;
    private final Map<String, String> labels;
    private final BaselineStatistics globalStats;
    private final List<HourlyBaseline> hourlyBaselines;

    /**
     * @param metricName      metric name; must not be {@code null}
     * @param labels          metric labels, may be {@code null}
     * @param globalStats     statistics over the whole history; must not be {@code null}
     * @param hourlyBaselines hour-of-day baselines, may be {@code null}
     */
    public Baseline(String metricName, Map<String, String> labels, BaselineStatistics globalStats,
            List<HourlyBaseline> hourlyBaselines) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.labels = labels != null
                ? Collections.unmodifiableMap(new TreeMap<>(labels))
                : Collections.emptyMap();
        this.globalStats = Objects.requireNonNull(globalStats, "globalStats must not be null");
        this.hourlyBaselines = hourlyBaselines != null ? List.copyOf(hourlyBaselines) : List.of();
    }

    /**
     * Baseline without hourly seasonality.
     */
    public static Baseline global(String metricName, Map<String, String> labels, BaselineStatistics stats) {
        return new Baseline(metricName, labels, stats, List.of());
    }

    public String getMetricName() {
        return metricName;
    }

    public Map<String, String> getLabels() {
        return labels;
    }

    public BaselineStatistics getGlobalStats() {
        return globalStats;
    }

    public List<HourlyBaseline> getHourlyBaselines() {
        return hourlyBaselines;
    }

    /**
     * Expected mean and standard deviation at {@code timestamp}.
     *
     * @param timestamp point in time; must not be {@code null}
     * @return expected value
     */
    public ExpectedValue getExpectedValue(Instant timestamp) {
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
        for (HourlyBaseline hourly : hourlyBaselines) {
            if (hourly.getHour() == utc.getHour()) {
                double adjustment = hourly.adjustmentFor(utc.getDayOfWeek());
                return new ExpectedValue(hourly.getStats().getMean() * adjustment,
                        hourly.getStats().getStd());
            }
        }
        return new ExpectedValue(globalStats.getMean(), globalStats.getStd());
    }

    /**
     * Lower and upper bound of {@code mean ± sigma × std} at {@code timestamp}.
     *
     * @return two-element array {@code [lower, upper]}
     */
    public double[] getThreshold(Instant timestamp, double sigma) {
        ExpectedValue expected = getExpectedValue(timestamp);
        return new double[] {
                expected.getMean() - sigma * expected.getStd(),
                expected.getMean() + sigma * expected.getStd()
        };
    }

    /**
     * @return the metric key this baseline belongs to
     */
    public String metricKey() {
        return MetricSeries.metricKey(metricName, labels);
    }

    @Override
    public String toString() {
        return "Baseline{" +
                "key='" + metricKey() + '\'' +
                ", globalStats=" + globalStats +
                ", hourly=" + hourlyBaselines.size() +
                '}';
    }
}
