package com.metricsentinel.core.model;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.List;
import java.util.Objects;

/**
 * Summary statistics of a metric's history, as computed by the baseline
 * engine.
 *
 * <p>
 * {@code std} is the population standard deviation and {@code mad} the
 * median absolute deviation around {@code median}.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaselineStatistics {

    private final double mean;
    private final double std;
    private final double median;
    private final double mad;
    private final double min;
    private final double max;
    private final double percentile5;
    private final double percentile25;
    private final double percentile75;
    private final double percentile95;
    private final int sampleCount;

    private BaselineStatistics(Builder b) {
        this.mean = b.mean;
        this.std = b.std;
        this.median = b.median;
        this.mad = b.mad;
        this.min = b.min;
        this.max = b.max;
        this.percentile5 = b.percentile5;
        this.percentile25 = b.percentile25;
        this.percentile75 = b.percentile75;
        this.percentile95 = b.percentile95;
        this.sampleCount = b.sampleCount;
    }

    /**
     * Compute statistics from raw values.
     *
     * @param values sample values; must not be {@code null} or empty
     * @return computed statistics
     * @throws IllegalArgumentException if {@code values} is empty
     */
    public static BaselineStatistics fromValues(List<Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Cannot calculate statistics from empty values");
        }

        double[] arr = values.stream().mapToDouble(Double::doubleValue).toArray();
        DescriptiveStatistics stats = new DescriptiveStatistics(arr);
        double median = new Median().evaluate(arr);

        double[] absDev = new double[arr.length];
        for (int i = 0; i < arr.length; i++) {
            absDev[i] = Math.abs(arr[i] - median);
        }

        return builder()
                .mean(stats.getMean())
                .std(Math.sqrt(stats.getPopulationVariance()))
                .median(median)
                .mad(new Median().evaluate(absDev))
                .min(stats.getMin())
                .max(stats.getMax())
                .percentile5(stats.getPercentile(5))
                .percentile25(stats.getPercentile(25))
                .percentile75(stats.getPercentile(75))
                .percentile95(stats.getPercentile(95))
                .sampleCount(arr.length)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    public double getMedian() {
        return median;
    }

    public double getMad() {
        return mad;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getPercentile5() {
        return percentile5;
    }

    public double getPercentile25() {
        return percentile25;
    }

    public double getPercentile75() {
        return percentile75;
    }

    public double getPercentile95() {
        return percentile95;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    /**
     * Fluent builder, mainly for baseline engines that already hold aggregates.
     */
    public static class Builder {
        private double mean;
        private double std;
        private double median;
        private double mad;
        private double min;
        private double max;
        private double percentile5;
        private double percentile25;
        private double percentile75;
        private double percentile95;
        private int sampleCount;

        public Builder mean(double v) {
            this.mean = v;
            return this;
        }

        public Builder std(double v) {
            this.std = v;
            return this;
        }

        public Builder median(double v) {
            this.median = v;
            return this;
        }

        public Builder mad(double v) {
            this.mad = v;
            return this;
        }

        public Builder min(double v) {
            this.min = v;
            return this;
        }

        public Builder max(double v) {
            this.max = v;
            return this;
        }

        public Builder percentile5(double v) {
            this.percentile5 = v;
            return this;
        }

        public Builder percentile25(double v) {
            this.percentile25 = v;
            return this;
        }

        public Builder percentile75(double v) {
            this.percentile75 = v;
            return this;
        }

        public Builder percentile95(double v) {
            this.percentile95 = v;
            return this;
        }

        public Builder sampleCount(int v) {
            this.sampleCount = v;
            return this;
        }

        /**
         * @return the statistics
         * @throws IllegalArgumentException if {@code std} or {@code mad} is negative
         */
        public BaselineStatistics build() {
            if (std < 0) {
                throw new IllegalArgumentException("std must be >= 0, got: " + std);
            }
            if (mad < 0) {
                throw new IllegalArgumentException("mad must be >= 0, got: " + mad);
            }
            return new BaselineStatistics(this);
        }
    }

    @Override
    public String toString() {
        return "BaselineStatistics{" +
                "mean=" + mean +
                ", std=" + std +
                ", median=" + median +
                ", mad=" + mad +
                ", sampleCount=" + sampleCount +
                '}';
    }
}
