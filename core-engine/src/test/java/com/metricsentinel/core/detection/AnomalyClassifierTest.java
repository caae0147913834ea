package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalySeverity;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.MetricSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalyClassifier}.
 */
class AnomalyClassifierTest {

    @Test
    @DisplayName("Should treat severity boundaries at 3, 4 and 5 as inclusive")
    void shouldClassifySeverityAtBoundaries() {
        MetricCategory unit = MetricCategory.INFRASTRUCTURE;

        assertThat(AnomalyClassifier.classifySeverity(2.999, unit)).isEqualTo(AnomalySeverity.LOW);
        assertThat(AnomalyClassifier.classifySeverity(3.0, unit)).isEqualTo(AnomalySeverity.MEDIUM);
        assertThat(AnomalyClassifier.classifySeverity(3.999, unit)).isEqualTo(AnomalySeverity.MEDIUM);
        assertThat(AnomalyClassifier.classifySeverity(4.0, unit)).isEqualTo(AnomalySeverity.HIGH);
        assertThat(AnomalyClassifier.classifySeverity(4.999, unit)).isEqualTo(AnomalySeverity.HIGH);
        assertThat(AnomalyClassifier.classifySeverity(5.0, unit)).isEqualTo(AnomalySeverity.CRITICAL);
    }

    @Test
    @DisplayName("Should classify negative deviations by magnitude")
    void shouldUseAbsoluteDeviation() {
        assertThat(AnomalyClassifier.classifySeverity(-4.2, MetricCategory.BUSINESS))
                .isEqualTo(AnomalySeverity.HIGH);
    }

    @Test
    @DisplayName("Should escalate money-moving categories faster")
    void shouldWeighByCategory() {
        assertThat(AnomalyClassifier.classifySeverity(2.5, MetricCategory.WALLET))
                .isEqualTo(AnomalySeverity.CRITICAL);
        assertThat(AnomalyClassifier.classifySeverity(2.5, MetricCategory.TRADING))
                .isEqualTo(AnomalySeverity.MEDIUM);
        assertThat(AnomalyClassifier.classifySeverity(2.5, MetricCategory.INFRASTRUCTURE))
                .isEqualTo(AnomalySeverity.LOW);
        assertThat(AnomalyClassifier.categoryWeight(null)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should classify a strictly monotonic tail over a long series as a trend")
    void shouldDetectTrend() {
        assertThat(AnomalyClassifier.classifyType(series(1, 1, 1, 1, 1, 1, 2, 3, 4, 5)))
                .isEqualTo(AnomalyType.TREND);
        assertThat(AnomalyClassifier.classifyType(series(9, 9, 9, 9, 9, 9, 8, 7, 6, 5)))
                .isEqualTo(AnomalyType.TREND);
    }

    @Test
    @DisplayName("Should classify flat steps, short series and spikes as point anomalies")
    void shouldDetectPoint() {
        assertThat(AnomalyClassifier.classifyType(series(1, 1, 1, 1, 1, 1, 2, 2, 4, 5)))
                .isEqualTo(AnomalyType.POINT);
        assertThat(AnomalyClassifier.classifyType(series(1, 2, 3, 4, 5, 6, 7, 8, 9)))
                .isEqualTo(AnomalyType.POINT);
        assertThat(AnomalyClassifier.classifyType(series(1, 1, 1, 1, 1, 1, 1, 1, 1, 50)))
                .isEqualTo(AnomalyType.POINT);
    }

    private static MetricSeries series(double... values) {
        Instant start = Instant.parse("2024-03-04T10:00:00Z");
        List<DataPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new DataPoint(start.plusSeconds(60L * i), values[i]));
        }
        return new MetricSeries("disk_usage_percent", MetricCategory.INFRASTRUCTURE, Map.of(), points);
    }
}
