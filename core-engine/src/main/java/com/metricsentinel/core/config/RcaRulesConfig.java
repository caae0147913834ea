package com.metricsentinel.core.config;

import com.metricsentinel.core.rca.CorrelationPattern;
import com.metricsentinel.core.rca.RcaRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the RCA rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - id: db-pool-exhaustion
 *     name: Database connection pool exhausted
 *     condition:
 *       primaryMetric: api_latency_p99
 *       primaryThreshold: 1.5
 *     rootCause: Database connection pool is exhausted
 *     severity: high
 *     remediation:
 *       - action: scale_connection_pool
 *         target: order-db
 * correlations:
 *   - name: latency_db
 *     metrics: [api_latency_p99, db_query_duration_p99]
 *     expectedCorrelation: positive
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every rule and pattern.
 * </p>
 *
 * @since 1.0.0
 */
public class RcaRulesConfig {

    private List<RcaRule> rules = new ArrayList<>();
    private List<CorrelationPattern> correlations = new ArrayList<>();

    /**
     * @return unmodifiable list of rules, in file order
     */
    public List<RcaRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void setRules(List<RcaRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public List<CorrelationPattern> getCorrelations() {
        return Collections.unmodifiableList(correlations);
    }

    public void setCorrelations(List<CorrelationPattern> correlations) {
        this.correlations = correlations != null ? new ArrayList<>(correlations) : new ArrayList<>();
    }

    /**
     * Validate every rule and correlation pattern, and check rule ids are
     * unique. Collects all errors and throws a single exception.
     *
     * @throws IllegalStateException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            RcaRule rule = rules.get(i);
            if (rule == null) {
                errors.add("Rule at index " + i + " is null");
                continue;
            }
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getId() != null && !ids.add(rule.getId())) {
                errors.add("Duplicate rule id '" + rule.getId() + "'");
            }
        }
        for (int i = 0; i < correlations.size(); i++) {
            CorrelationPattern pattern = correlations.get(i);
            if (pattern == null) {
                errors.add("Correlation at index " + i + " is null");
                continue;
            }
            try {
                pattern.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "RCA rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "RcaRulesConfig{rules=" + rules.size() + ", correlations=" + correlations.size() + '}';
    }
}
