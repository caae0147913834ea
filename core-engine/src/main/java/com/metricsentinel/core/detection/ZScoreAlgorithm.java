package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyScore;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.ExpectedValue;
import com.metricsentinel.core.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Z-score against the baseline's seasonal expectation.
 *
 * <p>
 * {@code z = |value - expected| / std}. The value is anomalous when
 * {@code z > threshold}; the normalized score is {@code min(z / (2 * threshold), 1)}.
 * A zero standard deviation yields a score of {@code 0} and no vote.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreAlgorithm implements ScoringAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreAlgorithm.class);

    private final double threshold;

    /**
     * @param threshold z-score above which a value is anomalous
     * @throws IllegalArgumentException if {@code threshold <= 0}
     */
    public ZScoreAlgorithm(double threshold) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
    }

    @Override
    public Optional<AnomalyScore> score(MetricSeries series, double value, Baseline baseline, Instant at) {
        if (baseline == null) {
            LOG.trace("zscore: no baseline for {} – skipping", series.metricKey());
            return Optional.empty();
        }

        ExpectedValue expected = baseline.getExpectedValue(at);
        if (!(expected.getStd() > 0)) {
            return Optional.of(new AnomalyScore(kind().id(), 0.0, threshold, false,
                    Map.of("zscore", 0.0, "expected", expected.getMean(), "std", 0.0)));
        }

        double z = Math.abs(value - expected.getMean()) / expected.getStd();
        boolean anomalous = z > threshold;
        double normalized = Math.min(z / (threshold * 2), 1.0);
        LOG.trace("zscore: metric={} z={} anomalous={}", series.metricKey(), z, anomalous);

        return Optional.of(new AnomalyScore(kind().id(), normalized, threshold, anomalous,
                Map.of("zscore", z, "expected", expected.getMean(), "std", expected.getStd())));
    }

    @Override
    public AlgorithmKind kind() {
        return AlgorithmKind.ZSCORE;
    }

    public double getThreshold() {
        return threshold;
    }
}
