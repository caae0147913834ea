package com.metricsentinel.core.rca;

import java.util.List;

/**
 * Source of declarative root-cause rules and correlation patterns.
 * <p>
 * Remote implementations own their call timeouts and may fail with a
 * {@link RuntimeException}; the {@link RcaEngine} then continues without
 * rule evidence.
 * </p>
 */
public interface RuleEngine {

    /**
     * @return rules matching the evidence, best match first
     */
    List<RcaRule> findMatchingRules(RuleQuery query);

    /**
     * @return declared metric correlation patterns
     */
    List<CorrelationPattern> getCorrelations();
}
