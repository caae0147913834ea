/**
 * Domain model for Metric Sentinel.
 *
 * <p>
 * Inputs supplied each cycle by external stores:
 * </p>
 * <ul>
 * <li>{@link com.metricsentinel.core.model.MetricSeries}: labelled time series</li>
 * <li>{@link com.metricsentinel.core.model.Baseline}: expected-value statistics</li>
 * <li>{@link com.metricsentinel.core.model.LogEntry} and
 * {@link com.metricsentinel.core.model.Event}: RCA evidence</li>
 * </ul>
 * <p>
 * Outputs of the detector:
 * {@link com.metricsentinel.core.model.Anomaly},
 * {@link com.metricsentinel.core.model.AnomalyScore} and
 * {@link com.metricsentinel.core.model.AnomalyBatch}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.model;
