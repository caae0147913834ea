package com.metricsentinel.core.model;

/**
 * Expected mean and standard deviation of a metric at a point in time.
 *
 * @since 1.0.0
 */
public final class ExpectedValue {

    private final double mean;
    private final double std;

    public ExpectedValue(double mean, double std) {
        this.mean = mean;
        this.std = std;
    }

    public double getMean() {
        return mean;
    }

    public double getStd() {
        return std;
    }

    @Override
    public String toString() {
        return "ExpectedValue{mean=" + mean + ", std=" + std + '}';
    }
}
