package com.metricsentinel.core.detection;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holder for the lazily trained isolation forest.
 *
 * <p>
 * {@link AlgorithmFactory} wires every {@link IsolationForestAlgorithm} to
 * {@link #shared()}, so the process trains one model on the first series
 * with enough history and every detector reuses it. Training is guarded by
 * double-checked locking; after that, scoring only reads immutable state.
 * </p>
 *
 * <h3>Outlier decision</h3>
 * <p>
 * Smile reports the anomaly score {@code 2^(-E(h)/c(n))}. The decision
 * offset is the {@code 1 - contamination} percentile of the training
 * scores, and a value is an outlier when its score lies above it.
 * </p>
 *
 * @since 1.0.0
 */
final class IsolationForestModel {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationForestModel.class);

    static final int NUM_TREES = 100;
    static final int MAX_SAMPLES = 256;
    static final double SAMPLING_RATE = 0.7;
    static final double CONTAMINATION = 0.1;
    static final long SEED = 42L;

    private static final IsolationForestModel SHARED = new IsolationForestModel();

    private final Object trainingLock = new Object();
    private final AtomicInteger trainingCount = new AtomicInteger();
    private volatile Trained trained;

    static IsolationForestModel shared() {
        return SHARED;
    }

    /**
     * Train on {@code values} unless a model exists already.
     *
     * @return the model every caller scores against
     */
    Trained trainIfAbsent(String metricKey, List<Double> values) {
        Trained result = trained;
        if (result == null) {
            synchronized (trainingLock) {
                result = trained;
                if (result == null) {
                    result = fit(Objects.requireNonNull(values, "values must not be null"));
                    trained = result;
                    trainingCount.incrementAndGet();
                    LOG.info("Isolation forest trained on metric={} points={} offset={}",
                            metricKey, values.size(), result.getOffset());
                }
            }
        }
        return result;
    }

    boolean isTrained() {
        return trained != null;
    }

    /**
     * @return how many models this holder has trained; at most {@code 1}
     */
    int trainingCount() {
        return trainingCount.get();
    }

    private static Trained fit(List<Double> values) {
        int n = values.size();
        double[][] data = new double[n][];
        for (int i = 0; i < n; i++) {
            data[i] = new double[] {values.get(i)};
        }

        // sub-sample at most MAX_SAMPLES points per tree
        double rate = Math.min(SAMPLING_RATE, (double) MAX_SAMPLES / n);
        int sampleSize = Math.max(2, (int) Math.round(n * rate));
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));

        MathEx.setSeed(SEED);
        IsolationForest forest = IsolationForest.fit(data, NUM_TREES, maxDepth, rate, 0);

        double[] trainingScores = new double[n];
        for (int i = 0; i < n; i++) {
            trainingScores[i] = forest.score(data[i]);
        }
        double offset = new Percentile().evaluate(trainingScores, 100.0 * (1.0 - CONTAMINATION));
        return new Trained(forest, offset);
    }

    /**
     * A fitted forest and its decision offset.
     */
    static final class Trained {

        private final IsolationForest forest;
        private final double offset;

        Trained(IsolationForest forest, double offset) {
            this.forest = forest;
            this.offset = offset;
        }

        /**
         * @return the anomaly score in {@code (0, 1]}, higher is more isolated
         */
        double anomalyScore(double value) {
            return forest.score(new double[] {value});
        }

        boolean isOutlier(double anomalyScore) {
            return anomalyScore > offset;
        }

        double getOffset() {
            return offset;
        }
    }
}
