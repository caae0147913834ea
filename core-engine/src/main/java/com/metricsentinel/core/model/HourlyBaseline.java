package com.metricsentinel.core.model;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Baseline statistics for one hour of the day (UTC), with optional
 * multiplicative day-of-week adjustments applied to the mean.
 *
 * @since 1.0.0
 */
public final class HourlyBaseline {

    private final int hour;
    private final BaselineStatistics stats;
    private final Map<DayOfWeek, Double> dayOfWeekAdjustments;

    /**
     * @param hour                 hour of day in [0, 23]
     * @param stats                statistics for that hour; must not be {@code null}
     * @param dayOfWeekAdjustments mean multipliers per weekday, may be {@code null}
     * @throws IllegalArgumentException if {@code hour} is out of range
     */
    public HourlyBaseline(int hour, BaselineStatistics stats, Map<DayOfWeek, Double> dayOfWeekAdjustments) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be in [0, 23], got: " + hour);
        }
        this.hour = hour;
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
        this.dayOfWeekAdjustments = dayOfWeekAdjustments == null || dayOfWeekAdjustments.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(dayOfWeekAdjustments));
    }

    public int getHour() {
        return hour;
    }

    public BaselineStatistics getStats() {
        return stats;
    }

    public Map<DayOfWeek, Double> getDayOfWeekAdjustments() {
        return dayOfWeekAdjustments;
    }

    /**
     * @param day weekday
     * @return mean multiplier for {@code day}, {@code 1.0} when none is defined
     */
    public double adjustmentFor(DayOfWeek day) {
        return dayOfWeekAdjustments.getOrDefault(day, 1.0);
    }
}
