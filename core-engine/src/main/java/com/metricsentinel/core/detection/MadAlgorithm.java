package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyScore;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.BaselineStatistics;
import com.metricsentinel.core.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Modified z-score based on the median absolute deviation of the baseline's
 * global statistics.
 *
 * <p>
 * {@code modZ = 0.6745 * |value - median| / mad}, anomalous when
 * {@code modZ > threshold}. A zero MAD yields a score of {@code 0} and no vote.
 * </p>
 *
 * @since 1.0.0
 */
public class MadAlgorithm implements ScoringAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(MadAlgorithm.class);

    /** Scales MAD to be a consistent estimator of the standard deviation for normal data. */
    static final double CONSISTENCY_CONSTANT = 0.6745;

    private final double threshold;

    public MadAlgorithm(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public Optional<AnomalyScore> score(MetricSeries series, double value, Baseline baseline, Instant at) {
        if (baseline == null) {
            LOG.trace("mad: no baseline for {} – skipping", series.metricKey());
            return Optional.empty();
        }

        BaselineStatistics stats = baseline.getGlobalStats();
        if (!(stats.getMad() > 0)) {
            return Optional.of(new AnomalyScore(kind().id(), 0.0, threshold, false,
                    Map.of("modified_zscore", 0.0, "median", stats.getMedian(), "mad", 0.0)));
        }

        double modZ = CONSISTENCY_CONSTANT * Math.abs(value - stats.getMedian()) / stats.getMad();
        boolean anomalous = modZ > threshold;
        double normalized = Math.min(modZ / (threshold * 2), 1.0);
        LOG.trace("mad: metric={} modZ={} anomalous={}", series.metricKey(), modZ, anomalous);

        return Optional.of(new AnomalyScore(kind().id(), normalized, threshold, anomalous,
                Map.of("modified_zscore", modZ, "median", stats.getMedian(), "mad", stats.getMad())));
    }

    @Override
    public AlgorithmKind kind() {
        return AlgorithmKind.MAD;
    }
}
