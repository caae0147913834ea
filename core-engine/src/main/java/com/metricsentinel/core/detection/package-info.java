/**
 * Ensemble anomaly detection over metric series.
 *
 * <p>
 * {@link com.metricsentinel.core.detection.AnomalyDetector} scores the latest
 * value of each series with every configured
 * {@link com.metricsentinel.core.detection.ScoringAlgorithm}, instantiated via
 * {@link com.metricsentinel.core.detection.AlgorithmFactory}. Built-in
 * algorithms:
 * </p>
 * <ul>
 * <li>{@link com.metricsentinel.core.detection.ZScoreAlgorithm}: distance from
 * the baseline's expected value in standard deviations</li>
 * <li>{@link com.metricsentinel.core.detection.MadAlgorithm}: modified z-score
 * using the median absolute deviation</li>
 * <li>{@link com.metricsentinel.core.detection.IsolationForestAlgorithm}:
 * isolation forest trained lazily on the series history</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add an algorithm, implement {@code ScoringAlgorithm}, add a constant to
 * {@code AlgorithmKind} and register it in {@code AlgorithmFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.detection;
