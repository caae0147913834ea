package com.metricsentinel.core.stats;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Mean, population standard deviation and z-score helpers over a series'
 * own values. Used where no baseline is available.
 *
 * @since 1.0.0
 */
public final class SeriesStatistics {

    private SeriesStatistics() {
        // utility class
    }

    /**
     * @return statistics over the last {@code window} values (all values when
     *         {@code window <= 0} or larger than the list)
     */
    public static DescriptiveStatistics of(List<Double> values, int window) {
        Objects.requireNonNull(values, "values must not be null");
        int from = window > 0 ? Math.max(0, values.size() - window) : 0;
        DescriptiveStatistics stats = new DescriptiveStatistics();
        for (int i = from; i < values.size(); i++) {
            stats.addValue(values.get(i));
        }
        return stats;
    }

    public static double mean(List<Double> values) {
        return values.isEmpty() ? 0.0 : of(values, 0).getMean();
    }

    /**
     * Population (biased) standard deviation, {@code 0} for an empty list.
     */
    public static double populationStd(List<Double> values) {
        return values.isEmpty() ? 0.0 : Math.sqrt(of(values, 0).getPopulationVariance());
    }

    /**
     * Absolute z-score of {@code value} against the mean and population
     * standard deviation of the last {@code window} values.
     *
     * @param values history, oldest first
     * @param value  value to score
     * @param window number of trailing values to use, {@code <= 0} for all
     * @return the z-score, or empty when the history is empty or has zero spread
     */
    public static OptionalDouble zScore(List<Double> values, double value, int window) {
        if (values.isEmpty()) {
            return OptionalDouble.empty();
        }
        DescriptiveStatistics stats = of(values, window);
        double std = Math.sqrt(stats.getPopulationVariance());
        if (!(std > 0)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.abs(value - stats.getMean()) / std);
    }
}
