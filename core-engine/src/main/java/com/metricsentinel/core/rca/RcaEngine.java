package com.metricsentinel.core.rca;

import com.metricsentinel.core.config.SentinelConfig;
import com.metricsentinel.core.evidence.CorrelatedValues;
import com.metricsentinel.core.evidence.EventEvidence;
import com.metricsentinel.core.evidence.LogPatternExtractor;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyContext;
import com.metricsentinel.core.model.Event;
import com.metricsentinel.core.model.LogEntry;
import com.metricsentinel.core.model.MetricSeries;
import com.metricsentinel.core.stats.SeriesStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Root-cause analysis for a single anomaly.
 *
 * <h3>Evidence</h3>
 * <p>
 * Related series, recent logs and recent events are reduced to correlated
 * values, log patterns and event types, and matched against the
 * {@link RuleEngine}. Declared correlation patterns add causes when a
 * co-listed metric is elevated as well. {@link ConfidenceScorer} blends the
 * evidence counts.
 * </p>
 *
 * <h3>LLM fallback</h3>
 * <p>
 * When the confidence stays below the configured threshold and an
 * {@link LlmClient} is wired, its free-text analysis is attached and the
 * confidence is raised once by {@link ConfidenceScorer#LLM_BONUS}. The text
 * never becomes a root cause.
 * </p>
 *
 * <h3>Failure handling</h3>
 * <p>
 * {@link #analyze} always returns a result. A failing rule engine or
 * correlation lookup is logged, the corresponding evidence is treated as
 * empty and the source is listed in {@link RcaResult#getUnavailableSources()}.
 * </p>
 *
 * <p>
 * Instances hold no per-call state and may analyse different anomalies
 * concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public class RcaEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RcaEngine.class);

    /** Correlation patterns are only consulted above this absolute deviation. */
    static final double CORRELATION_MIN_DEVIATION = 2.0;
    /** Trailing points a co-listed metric is compared against. */
    static final int CORRELATION_WINDOW = 10;
    static final double CORRELATION_ZSCORE = 2.0;

    static final int CORRELATED_ANOMALY_MIN_POINTS = 10;
    static final double CORRELATED_ANOMALY_ZSCORE = 2.5;

    static final int CONTEXT_MAX_EVENTS = 5;
    static final int CONTEXT_MAX_LOG_PATTERNS = 10;

    private final RuleEngine ruleEngine;
    private final LlmClient llmClient;
    private final double llmConfidenceThreshold;

    /**
     * @param ruleEngine             rule and correlation source
     * @param llmClient              advisory LLM, {@code null} to disable the fallback
     * @param llmConfidenceThreshold the LLM is consulted only below this confidence
     */
    public RcaEngine(RuleEngine ruleEngine, LlmClient llmClient, double llmConfidenceThreshold) {
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "RuleEngine must not be null");
        this.llmClient = llmClient;
        this.llmConfidenceThreshold = llmConfidenceThreshold;
    }

    /**
     * Wire the YAML rule engine and, when {@link SentinelConfig#isLlmConfigured()},
     * the Anthropic client.
     */
    public static RcaEngine fromConfig(SentinelConfig config) {
        LlmClient llm = config.isLlmConfigured() ? AnthropicLlmClient.fromConfig(config) : null;
        if (llm == null) {
            LOG.info("LLM analysis disabled: useLlm={} apiKeyPresent={}",
                    config.isUseLlm(), !config.getLlmApiKey().isBlank());
        }
        return new RcaEngine(YamlRuleEngine.fromConfig(config), llm, config.getLlmConfidenceThreshold());
    }

    /**
     * Analyse {@code anomaly} and attach an {@link AnomalyContext} to it.
     *
     * @param anomaly        the anomaly to explain
     * @param relatedMetrics snapshot of related series, may be {@code null}
     * @param recentLogs     recent log entries, may be {@code null}
     * @param recentEvents   recent events, may be {@code null}
     * @return the analysis; never {@code null}
     */
    public RcaResult analyze(Anomaly anomaly, List<MetricSeries> relatedMetrics, List<LogEntry> recentLogs,
            List<Event> recentEvents) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        List<MetricSeries> related = relatedMetrics != null ? relatedMetrics : List.of();
        List<LogEntry> logs = recentLogs != null ? recentLogs : List.of();
        List<Event> events = recentEvents != null ? recentEvents : List.of();
        List<String> unavailable = new ArrayList<>();

        Map<String, Double> correlatedValues = CorrelatedValues.latestByName(related);
        List<String> logPatterns = LogPatternExtractor.extract(logs);
        List<String> eventTypes = EventEvidence.eventTypes(events);

        List<RcaRule> matchedRules = matchRules(anomaly, correlatedValues, logPatterns, eventTypes, unavailable);
        Set<String> rootCauses = new LinkedHashSet<>();
        for (RcaRule rule : matchedRules) {
            if (rule.getRootCause() != null) {
                rootCauses.add(rule.getRootCause());
            }
        }

        List<String> correlationCauses = correlationCauses(anomaly, related, unavailable);
        rootCauses.addAll(correlationCauses);

        double confidence = ConfidenceScorer.score(matchedRules.size(), correlationCauses.size(),
                logPatterns.size(), eventTypes.size());
        List<String> correlatedAnomalies = correlatedAnomalies(anomaly, related);

        String llmAnalysis = null;
        if (llmClient != null && confidence < llmConfidenceThreshold) {
            Optional<String> analysis = askLlm(anomaly, new ArrayList<>(rootCauses), logs, events);
            if (analysis.isPresent()) {
                llmAnalysis = analysis.get();
                confidence = ConfidenceScorer.withLlmBonus(confidence);
            } else {
                unavailable.add(RcaResult.SOURCE_LLM);
            }
        }

        List<SuggestedAction> actions = suggestedActions(matchedRules);

        anomaly.setContext(new AnomalyContext(
                related.stream().filter(Objects::nonNull).map(MetricSeries::getName).toList(),
                EventEvidence.summaries(events, CONTEXT_MAX_EVENTS),
                logPatterns.subList(0, Math.min(CONTEXT_MAX_LOG_PATTERNS, logPatterns.size())),
                new ArrayList<>(rootCauses),
                anomaly.getContext().getSimilarIncidents()));

        RcaResult result = RcaResult.builder()
                .anomalyId(anomaly.getId())
                .rootCauses(new ArrayList<>(rootCauses))
                .matchedRules(matchedRules)
                .correlatedAnomalies(correlatedAnomalies)
                .llmAnalysis(llmAnalysis)
                .confidence(confidence)
                .suggestedActions(actions)
                .unavailableSources(unavailable)
                .build();

        LOG.info("RCA complete: anomalyId={} metric={} rules={} causes={} confidence={} llm={} unavailable={}",
                anomaly.getId(), anomaly.getMetricName(), matchedRules.size(), rootCauses.size(),
                String.format(Locale.ROOT, "%.2f", confidence), llmAnalysis != null, unavailable);
        return result;
    }

    // ---------------------------------------------------------------
    // Evidence stages
    // ---------------------------------------------------------------

    private List<RcaRule> matchRules(Anomaly anomaly, Map<String, Double> correlatedValues,
            List<String> logPatterns, List<String> eventTypes, List<String> unavailable) {
        RuleQuery query = new RuleQuery(anomaly.getMetricName(), anomaly.getCurrentValue(),
                correlatedValues, logPatterns, eventTypes);
        try {
            List<RcaRule> rules = ruleEngine.findMatchingRules(query);
            return rules != null ? rules : List.of();
        } catch (RuntimeException e) {
            LOG.warn("Rule engine unavailable for anomalyId={} – continuing without rules: {}",
                    anomaly.getId(), e.toString());
            unavailable.add(RcaResult.SOURCE_RULE_ENGINE);
            return List.of();
        }
    }

    private List<String> correlationCauses(Anomaly anomaly, List<MetricSeries> related, List<String> unavailable) {
        List<CorrelationPattern> patterns;
        try {
            patterns = ruleEngine.getCorrelations();
        } catch (RuntimeException e) {
            LOG.warn("Correlation patterns unavailable for anomalyId={}: {}", anomaly.getId(), e.toString());
            unavailable.add(RcaResult.SOURCE_CORRELATIONS);
            return List.of();
        }
        if (patterns == null || Math.abs(anomaly.getDeviation()) <= CORRELATION_MIN_DEVIATION) {
            return List.of();
        }

        Set<String> causes = new LinkedHashSet<>();
        for (CorrelationPattern pattern : patterns) {
            if (!pattern.involves(anomaly.getMetricName())) {
                continue;
            }
            for (String other : pattern.getMetrics()) {
                if (other.equals(anomaly.getMetricName())) {
                    continue;
                }
                findSeries(related, other).ifPresent(series -> {
                    double latest = series.getLatestValue().orElseThrow();
                    OptionalDouble z = SeriesStatistics.zScore(series.getValues(), latest, CORRELATION_WINDOW);
                    if (z.isPresent() && z.getAsDouble() > CORRELATION_ZSCORE) {
                        causes.add("Correlated anomaly in " + other
                                + " (" + pattern.getExpectedCorrelation() + " correlation)");
                    }
                });
            }
        }
        return new ArrayList<>(causes);
    }

    private static List<String> correlatedAnomalies(Anomaly anomaly, List<MetricSeries> related) {
        List<String> names = new ArrayList<>();
        for (MetricSeries series : related) {
            if (series == null || series.getName().equals(anomaly.getMetricName())
                    || series.size() < CORRELATED_ANOMALY_MIN_POINTS) {
                continue;
            }
            double latest = series.getLatestValue().orElseThrow();
            OptionalDouble z = SeriesStatistics.zScore(series.getValues(), latest, 0);
            if (z.isPresent() && z.getAsDouble() > CORRELATED_ANOMALY_ZSCORE) {
                names.add(series.getName());
            }
        }
        return names;
    }

    private Optional<String> askLlm(Anomaly anomaly, List<String> hypotheses, List<LogEntry> logs,
            List<Event> events) {
        try {
            return llmClient.complete(RcaPromptBuilder.build(anomaly, hypotheses, logs, events));
        } catch (RuntimeException e) {
            LOG.warn("LLM analysis failed for anomalyId={}: {}", anomaly.getId(), e.toString());
            return Optional.empty();
        }
    }

    static List<SuggestedAction> suggestedActions(List<RcaRule> matchedRules) {
        Map<String, SuggestedAction> byKey = new LinkedHashMap<>();
        for (RcaRule rule : matchedRules) {
            for (RemediationAction action : rule.getRemediation()) {
                byKey.putIfAbsent(action.dedupKey(), new SuggestedAction(action.getAction(), action.getTarget(),
                        action.getPriority(), rule.getId(), rule.getSeverityLevel()));
            }
        }
        List<SuggestedAction> actions = new ArrayList<>(byKey.values());
        actions.sort(Comparator.comparingInt(SuggestedAction::getPriority));
        return actions;
    }

    private static Optional<MetricSeries> findSeries(List<MetricSeries> related, String name) {
        return related.stream()
                .filter(Objects::nonNull)
                .filter(s -> s.getName().equals(name) && !s.isEmpty())
                .findFirst();
    }
}
