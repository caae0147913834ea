package com.metricsentinel.core.rca;

import com.metricsentinel.core.config.RcaRulesConfig;
import com.metricsentinel.core.config.RcaRulesLoader;
import com.metricsentinel.core.config.SentinelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link RuleEngine} over rules and correlation patterns loaded from YAML.
 *
 * <h3>Match score</h3>
 * <p>
 * Each rule is scored on the condition parts it declares:
 * </p>
 * <ul>
 * <li>primary metric: {@code 0.4} when the metric matches and its value is at
 * or above the threshold; otherwise {@code 0.2 * value / threshold} when that
 * ratio exceeds {@code 0.5}</li>
 * <li>correlated metrics: {@code 0.3 *} the share whose latest value is at or
 * above its threshold</li>
 * <li>log patterns: {@code 0.15 *} the share found, case-insensitive</li>
 * <li>event type: {@code 0.15 *} the share present</li>
 * </ul>
 * <p>
 * Rules scoring above zero match, best score first; ties keep file order.
 * </p>
 *
 * @since 1.0.0
 */
public class YamlRuleEngine implements RuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(YamlRuleEngine.class);

    private final List<RcaRule> rules;
    private final List<CorrelationPattern> correlations;

    public YamlRuleEngine(RcaRulesConfig config) {
        Objects.requireNonNull(config, "RcaRulesConfig must not be null");
        this.rules = List.copyOf(config.getRules());
        this.correlations = List.copyOf(config.getCorrelations());
    }

    /**
     * Load the rule file named by {@link SentinelConfig#getRulesPath()}, or the
     * bundled default.
     */
    public static YamlRuleEngine fromConfig(SentinelConfig config) {
        return new YamlRuleEngine(RcaRulesLoader.load(config.getRulesPath()));
    }

    @Override
    public List<RcaRule> findMatchingRules(RuleQuery query) {
        Objects.requireNonNull(query, "RuleQuery must not be null");
        List<ScoredRule> scored = new ArrayList<>();
        for (RcaRule rule : rules) {
            double score = matchScore(rule, query);
            if (score > 0) {
                scored.add(new ScoredRule(rule, score));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredRule::score).reversed());
        LOG.debug("Rule matching for metric={}: matched={}", query.getMetricName(), scored.size());
        return scored.stream().map(ScoredRule::rule).toList();
    }

    @Override
    public List<CorrelationPattern> getCorrelations() {
        return correlations;
    }

    public List<RcaRule> getRules() {
        return rules;
    }

    public Optional<RcaRule> getRule(String id) {
        return rules.stream().filter(r -> r.getId().equals(id)).findFirst();
    }

    /**
     * @return rules whose primary metric is {@code metricName}
     */
    public List<RcaRule> getRulesForMetric(String metricName) {
        return rules.stream()
                .filter(r -> r.getCondition().getPrimaryMetric().equals(metricName))
                .toList();
    }

    static double matchScore(RcaRule rule, RuleQuery query) {
        RuleCondition condition = rule.getCondition();
        double score = 0.0;

        String primary = condition.getPrimaryMetric();
        if (!primary.isEmpty() && primary.equals(query.getMetricName())) {
            double threshold = condition.getPrimaryThreshold();
            if (query.getMetricValue() >= threshold) {
                score += 0.4;
            } else {
                double ratio = threshold > 0 ? query.getMetricValue() / threshold : 0.0;
                if (ratio > 0.5) {
                    score += 0.2 * ratio;
                }
            }
        }

        List<CorrelatedMetric> correlated = condition.getCorrelatedMetrics();
        if (!correlated.isEmpty()) {
            Map<String, Double> values = query.getCorrelatedValues();
            long matches = correlated.stream()
                    .filter(cm -> values.containsKey(cm.getMetric()) && values.get(cm.getMetric()) >= cm.getThreshold())
                    .count();
            score += 0.3 * matches / correlated.size();
        }

        List<String> patterns = condition.getLogPatterns();
        if (!patterns.isEmpty()) {
            Set<String> found = query.getLogPatterns().stream()
                    .map(p -> p.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            long matches = patterns.stream()
                    .filter(p -> found.contains(p.toLowerCase(Locale.ROOT)))
                    .count();
            score += 0.15 * matches / patterns.size();
        }

        List<String> eventTypes = condition.getEventTypes();
        if (!eventTypes.isEmpty()) {
            long matches = eventTypes.stream().filter(query.getEventTypes()::contains).count();
            score += 0.15 * matches / eventTypes.size();
        }

        return score;
    }

    private static final class ScoredRule {
        private final RcaRule rule;
        private final double score;

        ScoredRule(RcaRule rule, double score) {
            this.rule = rule;
            this.score = score;
        }

        RcaRule rule() {
            return rule;
        }

        double score() {
            return score;
        }
    }
}
