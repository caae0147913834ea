package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.AnomalyScore;
import com.metricsentinel.core.model.Baseline;
import com.metricsentinel.core.model.BaselineStatistics;
import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.HourlyBaseline;
import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.MetricSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ZScoreAlgorithm}.
 */
class ZScoreAlgorithmTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:15:00Z");

    private final ZScoreAlgorithm algorithm = new ZScoreAlgorithm(3.0);
    private final MetricSeries series = new MetricSeries("cpu_usage_percent", MetricCategory.INFRASTRUCTURE,
            Map.of(), List.of(new DataPoint(NOW, 10.0)));

    @Test
    @DisplayName("Should abstain without a baseline")
    void shouldAbstainWithoutBaseline() {
        assertThat(algorithm.score(series, 20.0, null, NOW)).isEmpty();
    }

    @Test
    @DisplayName("Should vote for a value ten standard deviations away")
    void shouldVoteForOutlier() {
        Optional<AnomalyScore> score = algorithm.score(series, 20.0, baseline(10.0, 1.0), NOW);

        assertThat(score).isPresent();
        assertThat(score.get().isAnomaly()).isTrue();
        assertThat(score.get().getAlgorithm()).isEqualTo("zscore");
        assertThat(score.get().getScore()).isEqualTo(1.0);
        assertThat(score.get().getDetails().get("zscore")).isCloseTo(10.0, within(1e-9));
    }

    @Test
    @DisplayName("Should not vote at exactly the threshold")
    void shouldNotVoteAtThreshold() {
        AnomalyScore score = algorithm.score(series, 13.0, baseline(10.0, 1.0), NOW).orElseThrow();

        assertThat(score.isAnomaly()).isFalse();
        assertThat(score.getScore()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Should score zero without a vote when the standard deviation is zero")
    void shouldHandleZeroStd() {
        AnomalyScore score = algorithm.score(series, 50.0, baseline(10.0, 0.0), NOW).orElseThrow();

        assertThat(score.isAnomaly()).isFalse();
        assertThat(score.getScore()).isZero();
    }

    @Test
    @DisplayName("Should use the hourly baseline matching the timestamp")
    void shouldUseHourlyBaseline() {
        BaselineStatistics global = BaselineStatistics.builder().mean(10.0).std(1.0).build();
        BaselineStatistics tenOClock = BaselineStatistics.builder().mean(20.0).std(1.0).build();
        Baseline seasonal = new Baseline("cpu_usage_percent", Map.of(), global,
                List.of(new HourlyBaseline(10, tenOClock, Map.of())));

        AnomalyScore score = algorithm.score(series, 20.0, seasonal, NOW).orElseThrow();

        assertThat(score.isAnomaly()).isFalse();
        assertThat(score.getDetails().get("expected")).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void shouldRejectBadThreshold() {
        assertThatThrownBy(() -> new ZScoreAlgorithm(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Baseline baseline(double mean, double std) {
        return Baseline.global("cpu_usage_percent", Map.of(),
                BaselineStatistics.builder().mean(mean).std(std).median(mean).mad(std).build());
    }
}
