package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.SentinelConfig;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyBatch;
import com.metricsentinel.core.model.AnomalyScore;
import com.metricsentinel.core.model.AnomalySeverity;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.ExpectedValue;
import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.MetricSeries;
import com.metricsentinel.core.stats.SeriesStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ensemble anomaly detector with hysteresis-based lifecycle tracking.
 *
 * <h3>Detection cycle</h3>
 * <ol>
 * <li>For every non-empty series, fetch its baseline and run each enabled
 * {@link ScoringAlgorithm}. Algorithms that lack input abstain.</li>
 * <li>The series is anomalous when at least {@code ensembleMinVotes}
 * algorithms vote for it. Non-anomalous series cause no state change.</li>
 * <li>Voted anomalies are classified and upserted into the
 * {@link AnomalyState}; an already active anomaly for the same metric key is
 * refreshed in place and keeps its {@code startedAt}.</li>
 * <li>A resolution pass then re-checks every active anomaly whose series is
 * in the batch, including those voted this cycle, and resolves it once its
 * live z-score falls below {@code zscoreThreshold * resolutionFactor}.</li>
 * </ol>
 *
 * <h3>Failure handling</h3>
 * <p>
 * {@link #detect(List, Instant)} never throws for collaborator or per-metric
 * failures: a failing baseline lookup counts as a missing baseline, and an
 * unexpected error while evaluating one series is logged and the rest of the
 * batch is still evaluated.
 * </p>
 *
 * <h3>Threading</h3>
 * <p>
 * With {@code detectionParallelism > 1} series are evaluated on a fixed
 * thread pool owned by this detector; {@link #close()} shuts it down.
 * Calls to {@link #detect(List, Instant)} themselves should not overlap.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyDetector.class);

    private final SentinelConfig config;
    private final BaselineProvider baselineProvider;
    private final List<ScoringAlgorithm> ensemble;
    private final AnomalyState state;
    private final ExecutorService executor;

    /**
     * @param config           detection configuration
     * @param baselineProvider source of baselines
     */
    public AnomalyDetector(SentinelConfig config, BaselineProvider baselineProvider) {
        this(config, baselineProvider, AlgorithmFactory.createAll(config));
    }

    /**
     * @param algorithms dispatch table of the ensemble members to run
     */
    public AnomalyDetector(SentinelConfig config, BaselineProvider baselineProvider,
            Map<AlgorithmKind, ScoringAlgorithm> algorithms) {
        this.config = Objects.requireNonNull(config, "SentinelConfig must not be null");
        this.baselineProvider = Objects.requireNonNull(baselineProvider, "BaselineProvider must not be null");
        Objects.requireNonNull(algorithms, "algorithms must not be null");
        if (algorithms.isEmpty()) {
            throw new IllegalArgumentException("At least one scoring algorithm is required");
        }
        this.ensemble = algorithms.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(Map.Entry::getValue)
                .toList();
        this.state = new AnomalyState(config.getResolvedHistoryLimit());
        this.executor = config.getDetectionParallelism() > 1
                ? Executors.newFixedThreadPool(config.getDetectionParallelism(), new DetectionThreadFactory())
                : null;
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    public AnomalyBatch detect(List<MetricSeries> metrics) {
        return detect(metrics, Instant.now());
    }

    /**
     * Run one detection cycle.
     *
     * @param metrics series to evaluate; {@code null} entries and empty series are skipped
     * @param now     detection time
     * @return the anomalies voted this cycle and the anomalies resolved by it
     */
    public AnomalyBatch detect(List<MetricSeries> metrics, Instant now) {
        Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(now, "now must not be null");
        long startNanos = System.nanoTime();

        List<MetricSeries> candidates = metrics.stream()
                .filter(Objects::nonNull)
                .filter(series -> !series.isEmpty())
                .toList();

        List<Anomaly> detected = executor != null
                ? evaluateParallel(candidates, now)
                : evaluateSequential(candidates, now);

        List<Anomaly> resolved = resolvePass(candidates, now);

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        AnomalyBatch batch = new AnomalyBatch(now, detected, resolved, candidates.size(), durationMs);
        if (!detected.isEmpty() || !resolved.isEmpty()) {
            LOG.info("Detection cycle: metricsChecked={} anomalies={} critical={} resolved={} durationMs={}",
                    candidates.size(), detected.size(), batch.criticalCount(), resolved.size(), durationMs);
        } else {
            LOG.debug("Detection cycle: metricsChecked={} anomalies=0 durationMs={}", candidates.size(), durationMs);
        }
        return batch;
    }

    private List<Anomaly> evaluateSequential(List<MetricSeries> candidates, Instant now) {
        List<Anomaly> detected = new ArrayList<>();
        for (MetricSeries series : candidates) {
            safeEvaluate(series, now).ifPresent(detected::add);
        }
        return detected;
    }

    private List<Anomaly> evaluateParallel(List<MetricSeries> candidates, Instant now) {
        List<Future<Optional<Anomaly>>> futures = new ArrayList<>(candidates.size());
        for (MetricSeries series : candidates) {
            futures.add(executor.submit(() -> safeEvaluate(series, now)));
        }

        List<Anomaly> detected = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get().ifPresent(detected::add);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Detection interrupted after {} of {} metric(s)", i, futures.size());
                break;
            } catch (ExecutionException e) {
                LOG.error("Evaluation of metric={} failed – continuing with next metric",
                        candidates.get(i).metricKey(), e.getCause());
            }
        }
        return detected;
    }

    private Optional<Anomaly> safeEvaluate(MetricSeries series, Instant now) {
        try {
            return evaluate(series, now);
        } catch (RuntimeException e) {
            LOG.error("Evaluation of metric={} threw an exception – continuing with next metric",
                    series.metricKey(), e);
            return Optional.empty();
        }
    }

    /**
     * Score one series and, when the ensemble votes for it, upsert the
     * resulting anomaly into the state.
     */
    Optional<Anomaly> evaluate(MetricSeries series, Instant now) {
        Optional<Double> latest = series.getLatestValue();
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        double value = latest.get();
        Baseline baseline = fetchBaseline(series).orElse(null);

        List<AnomalyScore> scores = new ArrayList<>();
        int votes = 0;
        for (ScoringAlgorithm algorithm : ensemble) {
            Optional<AnomalyScore> score = algorithm.score(series, value, baseline, now);
            if (score.isPresent()) {
                scores.add(score.get());
                if (score.get().isAnomaly()) {
                    votes++;
                }
            }
        }

        if (votes < config.getEnsembleMinVotes()) {
            LOG.trace("metric={} votes={} (< {}) – not anomalous",
                    series.metricKey(), votes, config.getEnsembleMinVotes());
            return Optional.empty();
        }

        Anomaly candidate = buildAnomaly(series, value, baseline, scores, now);
        Anomaly current = state.upsert(candidate);
        LOG.debug("metric={} votes={} severity={} deviation={} durationMinutes={}",
                current.metricKey(), votes, current.getSeverity(), current.getDeviation(),
                current.getDurationMinutes());
        return Optional.of(current);
    }

    private Anomaly buildAnomaly(MetricSeries series, double value, Baseline baseline,
            List<AnomalyScore> scores, Instant now) {
        double expected;
        double std;
        double deviationPercent = 0.0;
        if (baseline != null) {
            ExpectedValue ev = baseline.getExpectedValue(now);
            expected = ev.getMean();
            std = ev.getStd();
            if (expected != 0) {
                deviationPercent = (value - expected) / expected * 100.0;
            }
        } else {
            // degraded: deviation against the series' own history
            List<Double> values = series.getValues();
            expected = SeriesStatistics.mean(values);
            std = SeriesStatistics.populationStd(values);
        }
        double deviation = std > 0 ? (value - expected) / std : 0.0;

        double ensembleScore = scores.stream()
                .mapToDouble(AnomalyScore::getScore)
                .filter(s -> s > 0)
                .average()
                .orElse(0.0);

        return Anomaly.builder()
                .detectedAt(now)
                .startedAt(now)
                .metricName(series.getName())
                .category(series.getCategory())
                .labels(series.getLabels())
                .currentValue(value)
                .baselineValue(expected)
                .deviation(deviation)
                .deviationPercent(deviationPercent)
                .type(AnomalyClassifier.classifyType(series))
                .severity(AnomalyClassifier.classifySeverity(deviation, series.getCategory()))
                .scores(scores)
                .ensembleScore(ensembleScore)
                .build();
    }

    // ---------------------------------------------------------------
    // Resolution
    // ---------------------------------------------------------------

    private List<Anomaly> resolvePass(List<MetricSeries> candidates, Instant now) {
        double resolveBelow = config.getZscoreThreshold() * config.getResolutionFactor();
        List<Anomaly> resolved = new ArrayList<>();

        for (MetricSeries series : candidates) {
            String key = series.metricKey();
            Optional<Anomaly> active = state.get(key);
            if (active.isEmpty()) {
                continue;
            }
            try {
                Optional<Baseline> baseline = fetchBaseline(series);
                Optional<Double> latest = series.getLatestValue();
                if (baseline.isEmpty() || latest.isEmpty()) {
                    active.get().updateDuration(now);
                    continue;
                }
                ExpectedValue expected = baseline.get().getExpectedValue(now);
                if (expected.getStd() > 0) {
                    double z = Math.abs(latest.get() - expected.getMean()) / expected.getStd();
                    if (z < resolveBelow) {
                        state.resolve(key, now).ifPresent(anomaly -> {
                            resolved.add(anomaly);
                            LOG.info("Anomaly resolved: id={} metric={} z={} durationMinutes={}",
                                    anomaly.getId(), key, z, anomaly.getDurationMinutes());
                        });
                        continue;
                    }
                }
                active.get().updateDuration(now);
            } catch (RuntimeException e) {
                LOG.error("Resolution check for metric={} threw an exception – keeping anomaly active", key, e);
            }
        }
        return resolved;
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public List<Anomaly> getActiveAnomalies() {
        return getActiveAnomalies(null, null);
    }

    /**
     * @param category optional category filter, {@code null} for all
     * @param severity optional severity filter, {@code null} for all
     * @return active anomalies, most recently detected first
     */
    public List<Anomaly> getActiveAnomalies(MetricCategory category, AnomalySeverity severity) {
        return state.activeAnomalies().stream()
                .filter(a -> category == null || a.getCategory() == category)
                .filter(a -> severity == null || a.getSeverity() == severity)
                .sorted(Comparator.comparing(Anomaly::getDetectedAt).reversed())
                .toList();
    }

    /**
     * Acknowledge an active anomaly.
     *
     * @return {@code false} if no active anomaly has {@code anomalyId}
     */
    public boolean acknowledgeAnomaly(String anomalyId, String acknowledgedBy) {
        if (anomalyId == null) {
            return false;
        }
        boolean found = state.acknowledge(anomalyId, acknowledgedBy);
        if (found) {
            LOG.info("Anomaly acknowledged: id={} by={}", anomalyId, acknowledgedBy);
        } else {
            LOG.debug("Acknowledge ignored: no active anomaly with id={}", anomalyId);
        }
        return found;
    }

    public AnomalyState getState() {
        return state;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Optional<Baseline> fetchBaseline(MetricSeries series) {
        try {
            return Objects.requireNonNullElse(
                    baselineProvider.getBaseline(series.getName(), series.getLabels()), Optional.empty());
        } catch (RuntimeException e) {
            LOG.warn("Baseline lookup failed for metric={} – treating as missing: {}",
                    series.metricKey(), e.toString());
            return Optional.empty();
        }
    }

    private static final class DetectionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "anomaly-detector-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
