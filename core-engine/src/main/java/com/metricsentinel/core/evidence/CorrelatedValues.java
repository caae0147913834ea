package com.metricsentinel.core.evidence;

import com.metricsentinel.core.model.MetricSeries;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Latest value of each related series, keyed by metric name.
 *
 * @since 1.0.0
 */
public final class CorrelatedValues {

    private CorrelatedValues() {
        // utility class
    }

    /**
     * Series without data are skipped. When several series share a name the
     * last one wins.
     *
     * @return unmodifiable map in input order
     */
    public static Map<String, Double> latestByName(List<MetricSeries> series) {
        if (series == null || series.isEmpty()) {
            return Map.of();
        }
        Map<String, Double> values = new LinkedHashMap<>();
        for (MetricSeries s : series) {
            if (s != null) {
                s.getLatestValue().ifPresent(v -> values.put(s.getName(), v));
            }
        }
        return Collections.unmodifiableMap(values);
    }
}
