package com.metricsentinel.core.rca;

/**
 * A secondary metric whose elevation supports a rule's hypothesis.
 *
 * @since 1.0.0
 */
public class CorrelatedMetric {

    private String metric;
    private double threshold;
    private String correlation = "positive";

    public CorrelatedMetric() {
    }

    public CorrelatedMetric(String metric, double threshold) {
        this.metric = metric;
        this.threshold = threshold;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    /** @return minimum latest value for the metric to count as supporting evidence */
    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    /** @return {@code positive} or {@code negative} */
    public String getCorrelation() {
        return correlation;
    }

    public void setCorrelation(String correlation) {
        this.correlation = correlation;
    }

    @Override
    public String toString() {
        return metric + ">=" + threshold + " (" + correlation + ")";
    }
}
