package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.MetricSeries;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link BaselineProvider} keyed by metric key and held in memory.
 *
 * @since 1.0.0
 */
public class InMemoryBaselineProvider implements BaselineProvider {

    private final Map<String, Baseline> baselines = new ConcurrentHashMap<>();

    public void put(Baseline baseline) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        baselines.put(baseline.metricKey(), baseline);
    }

    public boolean remove(String metricName, Map<String, String> labels) {
        return baselines.remove(MetricSeries.metricKey(metricName, labels)) != null;
    }

    public int size() {
        return baselines.size();
    }

    @Override
    public Optional<Baseline> getBaseline(String metricName, Map<String, String> labels) {
        return Optional.ofNullable(baselines.get(MetricSeries.metricKey(metricName, labels)));
    }
}
