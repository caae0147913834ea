package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyScore;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.MetricSeries;

import java.time.Instant;
import java.util.Optional;

/**
 * Contract for one member of the detection ensemble.
 * <p>
 * An algorithm scores the current value of a series and casts one vote via
 * {@link AnomalyScore#isAnomaly()}. When its inputs are missing (no baseline,
 * too little history) it abstains by returning {@link Optional#empty()}; it
 * never throws for missing data.
 * </p>
 * <p>
 * Implementations must be safe to call from several threads at once.
 * </p>
 */
public interface ScoringAlgorithm {

    /**
     * @param series   the series being evaluated; never empty
     * @param value    the value to score, normally the series' latest value
     * @param baseline baseline for the series, or {@code null} if none exists
     * @param at       detection time, used to pick the seasonal expectation
     * @return the verdict, or empty if the algorithm cannot score this input
     */
    Optional<AnomalyScore> score(MetricSeries series, double value, Baseline baseline, Instant at);

    /**
     * @return which ensemble slot this algorithm fills
     */
    AlgorithmKind kind();
}
