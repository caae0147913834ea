package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalySeverity;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.MetricSeries;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Severity and type classification for voted anomalies.
 *
 * <p>
 * Severity is derived from {@code |deviation| * categoryWeight}: money-moving
 * categories (risk, wallet, trading, matching) escalate faster than
 * infrastructure or business metrics.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyClassifier {

    static final double CRITICAL_THRESHOLD = 5.0;
    static final double HIGH_THRESHOLD = 4.0;
    static final double MEDIUM_THRESHOLD = 3.0;

    /** Minimum series length before a trend classification is considered. */
    static final int TREND_MIN_POINTS = 10;
    static final int TREND_WINDOW = 5;

    private static final Map<MetricCategory, Double> CATEGORY_WEIGHTS;

    static {
        Map<MetricCategory, Double> weights = new EnumMap<>(MetricCategory.class);
        weights.put(MetricCategory.TRADING, 1.5);
        weights.put(MetricCategory.MATCHING, 1.5);
        weights.put(MetricCategory.RISK, 2.0);
        weights.put(MetricCategory.WALLET, 2.0);
        weights.put(MetricCategory.API, 1.2);
        weights.put(MetricCategory.INFRASTRUCTURE, 1.0);
        weights.put(MetricCategory.DATABASE, 1.3);
        weights.put(MetricCategory.QUEUE, 1.2);
        weights.put(MetricCategory.BUSINESS, 1.0);
        CATEGORY_WEIGHTS = Collections.unmodifiableMap(weights);
    }

    private AnomalyClassifier() {
        // utility class
    }

    public static double categoryWeight(MetricCategory category) {
        return category == null ? 1.0 : CATEGORY_WEIGHTS.getOrDefault(category, 1.0);
    }

    /**
     * @param deviation signed deviation in standard deviations
     * @param category  metric category, {@code null} weighs 1.0
     */
    public static AnomalySeverity classifySeverity(double deviation, MetricCategory category) {
        return severityForWeighted(Math.abs(deviation) * categoryWeight(category));
    }

    static AnomalySeverity severityForWeighted(double weighted) {
        if (weighted >= CRITICAL_THRESHOLD) {
            return AnomalySeverity.CRITICAL;
        } else if (weighted >= HIGH_THRESHOLD) {
            return AnomalySeverity.HIGH;
        } else if (weighted >= MEDIUM_THRESHOLD) {
            return AnomalySeverity.MEDIUM;
        }
        return AnomalySeverity.LOW;
    }

    /**
     * {@link AnomalyType#TREND} when the series has at least
     * {@value #TREND_MIN_POINTS} points and its last {@value #TREND_WINDOW}
     * values are strictly increasing or strictly decreasing.
     */
    public static AnomalyType classifyType(MetricSeries series) {
        if (series.size() < TREND_MIN_POINTS) {
            return AnomalyType.POINT;
        }
        List<Double> values = series.getValues();
        List<Double> tail = values.subList(values.size() - TREND_WINDOW, values.size());

        boolean increasing = true;
        boolean decreasing = true;
        for (int i = 1; i < tail.size(); i++) {
            double prev = tail.get(i - 1);
            double cur = tail.get(i);
            increasing &= cur > prev;
            decreasing &= cur < prev;
        }
        return increasing || decreasing ? AnomalyType.TREND : AnomalyType.POINT;
    }
}
