package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyScore;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ensemble member backed by a Smile isolation forest.
 *
 * <p>
 * The model lives in an {@link IsolationForestModel}. It is trained lazily on
 * the values of the first series that has at least {@value #MIN_HISTORY}
 * points and then reused for every series. The no-arg constructor uses the
 * process-wide holder, so all detectors share a single trained model.
 * </p>
 *
 * <h3>Score</h3>
 * <p>
 * The reported score is {@code clip(anomalyScore + 0.5, 0, 1)} with the
 * forest's raw anomaly score. The vote is the forest's outlier
 * classification against its contamination offset.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationForestAlgorithm implements ScoringAlgorithm {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestAlgorithm.class);

    /** Minimum history a series needs before this algorithm votes. */
    static final int MIN_HISTORY = 100;

    private static final double DECISION_SCORE = 0.5;

    private final IsolationForestModel model;

    public IsolationForestAlgorithm() {
        this(IsolationForestModel.shared());
    }

    IsolationForestAlgorithm(IsolationForestModel model) {
        this.model = Objects.requireNonNull(model, "IsolationForestModel must not be null");
    }

    @Override
    public Optional<AnomalyScore> score(MetricSeries series, double value, Baseline baseline, Instant at) {
        if (series.size() < MIN_HISTORY) {
            LOG.trace("isolation_forest: {} has {} points (< {}) – skipping",
                    series.metricKey(), series.size(), MIN_HISTORY);
            return Optional.empty();
        }

        IsolationForestModel.Trained forest = model.trainIfAbsent(series.metricKey(), series.getValues());
        double raw = forest.anomalyScore(value);
        double normalized = Math.max(0.0, Math.min(1.0, raw + 0.5));

        return Optional.of(new AnomalyScore(kind().id(), normalized, DECISION_SCORE, forest.isOutlier(raw),
                Map.of("raw_score", raw, "offset", forest.getOffset())));
    }

    @Override
    public AlgorithmKind kind() {
        return AlgorithmKind.ISOLATION_FOREST;
    }

    /**
     * @return how many times the backing holder trained a model; at most {@code 1}
     */
    public int trainingCount() {
        return model.trainingCount();
    }

    public boolean isTrained() {
        return model.isTrained();
    }

    IsolationForestModel model() {
        return model;
    }
}
