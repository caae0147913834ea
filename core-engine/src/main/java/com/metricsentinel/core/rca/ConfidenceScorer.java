package com.metricsentinel.core.rca;

/**
 * Blends heterogeneous RCA evidence into a confidence in [0, 1].
 *
 * <p>
 * Each evidence category has a weight and a per-item increment. A category
 * contributes {@code weight * min(1, count * increment)}, and the sum is
 * capped at {@code 1.0}. With no evidence the confidence is exactly 0.
 * </p>
 *
 * <table>
 * <caption>Weights</caption>
 * <tr><th>Category</th><th>Weight</th><th>Increment</th></tr>
 * <tr><td>matched rules</td><td>0.40</td><td>0.15</td></tr>
 * <tr><td>correlation causes</td><td>0.25</td><td>0.10</td></tr>
 * <tr><td>log patterns</td><td>0.20</td><td>0.05</td></tr>
 * <tr><td>event types</td><td>0.15</td><td>0.05</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class ConfidenceScorer {

    static final double RULE_WEIGHT = 0.4;
    static final double RULE_INCREMENT = 0.15;
    static final double CORRELATION_WEIGHT = 0.25;
    static final double CORRELATION_INCREMENT = 0.1;
    static final double LOG_WEIGHT = 0.2;
    static final double LOG_INCREMENT = 0.05;
    static final double EVENT_WEIGHT = 0.15;
    static final double EVENT_INCREMENT = 0.05;

    /** Flat bonus applied once when an LLM analysis is attached. */
    public static final double LLM_BONUS = 0.2;

    private ConfidenceScorer() {
        // utility class
    }

    public static double score(int matchedRules, int correlationCauses, int logPatterns, int eventTypes) {
        double confidence = contribution(RULE_WEIGHT, RULE_INCREMENT, matchedRules)
                + contribution(CORRELATION_WEIGHT, CORRELATION_INCREMENT, correlationCauses)
                + contribution(LOG_WEIGHT, LOG_INCREMENT, logPatterns)
                + contribution(EVENT_WEIGHT, EVENT_INCREMENT, eventTypes);
        return Math.min(confidence, 1.0);
    }

    /**
     * @return {@code confidence + LLM_BONUS}, capped at 1.0
     */
    public static double withLlmBonus(double confidence) {
        return Math.min(confidence + LLM_BONUS, 1.0);
    }

    private static double contribution(double weight, double increment, int count) {
        if (count <= 0) {
            return 0.0;
        }
        return weight * Math.min(1.0, count * increment);
    }
}
