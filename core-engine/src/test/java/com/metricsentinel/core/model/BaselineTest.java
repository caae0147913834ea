package com.metricsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Baseline} and {@link BaselineStatistics}.
 */
class BaselineTest {

    // 2024-03-04 is a Monday
    private static final Instant MONDAY_NINE = Instant.parse("2024-03-04T09:15:00Z");
    private static final Instant MONDAY_TEN = Instant.parse("2024-03-04T10:15:00Z");
    private static final Instant TUESDAY_NINE = Instant.parse("2024-03-05T09:15:00Z");

    @Test
    @DisplayName("Should compute robust statistics from raw values")
    void statisticsFromValues() {
        BaselineStatistics stats = BaselineStatistics.fromValues(
                List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0, 10.0));

        assertThat(stats.getMean()).isEqualTo(5.5);
        assertThat(stats.getStd()).isCloseTo(Math.sqrt(8.25), within(1e-9));
        assertThat(stats.getMedian()).isEqualTo(5.5);
        assertThat(stats.getMad()).isEqualTo(2.5);
        assertThat(stats.getMin()).isEqualTo(1.0);
        assertThat(stats.getMax()).isEqualTo(10.0);
        assertThat(stats.getPercentile25()).isCloseTo(2.75, within(1e-9));
        assertThat(stats.getPercentile75()).isCloseTo(8.25, within(1e-9));
        assertThat(stats.getSampleCount()).isEqualTo(10);
    }

    @Test
    @DisplayName("Should reject empty values and negative spread")
    void rejectsInvalidStatistics() {
        assertThatThrownBy(() -> BaselineStatistics.fromValues(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty");
        assertThatThrownBy(() -> BaselineStatistics.builder().std(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("std");
    }

    @Test
    @DisplayName("Should use the hourly baseline with its day-of-week adjustment")
    void hourlyExpectedValue() {
        Baseline baseline = seasonalBaseline();

        ExpectedValue monday = baseline.getExpectedValue(MONDAY_NINE);
        assertThat(monday.getMean()).isCloseTo(240.0, within(1e-9));
        assertThat(monday.getStd()).isEqualTo(20.0);

        assertThat(baseline.getExpectedValue(TUESDAY_NINE).getMean()).isEqualTo(200.0);
    }

    @Test
    @DisplayName("Should fall back to global statistics when no hourly baseline covers the hour")
    void globalExpectedValue() {
        ExpectedValue expected = seasonalBaseline().getExpectedValue(MONDAY_TEN);

        assertThat(expected.getMean()).isEqualTo(100.0);
        assertThat(expected.getStd()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should derive a symmetric threshold band from the expected value")
    void thresholdBand() {
        double[] band = seasonalBaseline().getThreshold(MONDAY_TEN, 3.0);

        assertThat(band).containsExactly(70.0, 130.0);
    }

    @Test
    @DisplayName("Should key the baseline by metric name and sorted labels")
    void metricKey() {
        Baseline baseline = Baseline.global("orders_total", Map.of("region", "eu", "env", "prod"),
                BaselineStatistics.builder().mean(1).std(1).build());

        assertThat(baseline.metricKey()).isEqualTo("orders_total{env=prod,region=eu}");
    }

    @Test
    @DisplayName("Should reject an hour outside the day")
    void rejectsBadHour() {
        assertThatThrownBy(() -> new HourlyBaseline(24, BaselineStatistics.builder().build(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hour");
    }

    private static Baseline seasonalBaseline() {
        BaselineStatistics global = BaselineStatistics.builder().mean(100).std(10).build();
        HourlyBaseline nineAm = new HourlyBaseline(9, BaselineStatistics.builder().mean(200).std(20).build(),
                Map.of(DayOfWeek.MONDAY, 1.2));
        return new Baseline("orders_total", Map.of(), global, List.of(nineAm));
    }
}
