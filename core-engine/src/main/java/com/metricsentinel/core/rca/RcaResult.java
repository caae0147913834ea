package com.metricsentinel.core.rca;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of one root-cause analysis run. Not stored by the engine.
 *
 * <p>
 * {@link #getLlmAnalysis()} is advisory only: it never contributes to
 * {@link #getRootCauses()} or {@link #getMatchedRules()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RcaResult {

    /** Degraded-source tags reported in {@link #getUnavailableSources()}. */
    public static final String SOURCE_RULE_ENGINE = "rule-engine";
    public static final String SOURCE_CORRELATIONS = "correlations";
    public static final String SOURCE_LLM = "llm";

    private final String anomalyId;
    private final List<String> rootCauses;
    private final List<RcaRule> matchedRules;
    private final List<String> correlatedAnomalies;
    private final String llmAnalysis;
    private final double confidence;
    private final List<SuggestedAction> suggestedActions;
    private final List<String> unavailableSources;
    private final Instant createdAt;

    private RcaResult(Builder b) {
        this.anomalyId = Objects.requireNonNull(b.anomalyId, "anomalyId must not be null");
        this.rootCauses = List.copyOf(b.rootCauses);
        this.matchedRules = List.copyOf(b.matchedRules);
        this.correlatedAnomalies = List.copyOf(b.correlatedAnomalies);
        this.llmAnalysis = b.llmAnalysis;
        this.confidence = b.confidence;
        this.suggestedActions = List.copyOf(b.suggestedActions);
        this.unavailableSources = List.copyOf(b.unavailableSources);
        this.createdAt = b.createdAt != null ? b.createdAt : Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    /** @return distinct root-cause hypotheses, rule causes first */
    public List<String> getRootCauses() {
        return rootCauses;
    }

    public List<RcaRule> getMatchedRules() {
        return matchedRules;
    }

    /** @return names of related metrics that are themselves anomalous */
    public List<String> getCorrelatedAnomalies() {
        return correlatedAnomalies;
    }

    public Optional<String> getLlmAnalysis() {
        return Optional.ofNullable(llmAnalysis);
    }

    public double getConfidence() {
        return confidence;
    }

    /** @return deduplicated remediation steps, most urgent first */
    public List<SuggestedAction> getSuggestedActions() {
        return suggestedActions;
    }

    public List<String> getUnavailableSources() {
        return unavailableSources;
    }

    public boolean isDegraded() {
        return !unavailableSources.isEmpty();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "RcaResult{" +
                "anomalyId='" + anomalyId + '\'' +
                ", rootCauses=" + rootCauses +
                ", matchedRules=" + matchedRules.size() +
                ", correlatedAnomalies=" + correlatedAnomalies +
                ", llmAnalysis=" + (llmAnalysis != null) +
                ", confidence=" + confidence +
                ", suggestedActions=" + suggestedActions.size() +
                ", unavailableSources=" + unavailableSources +
                '}';
    }

    public static final class Builder {
        private String anomalyId;
        private List<String> rootCauses = List.of();
        private List<RcaRule> matchedRules = List.of();
        private List<String> correlatedAnomalies = List.of();
        private String llmAnalysis;
        private double confidence;
        private List<SuggestedAction> suggestedActions = List.of();
        private List<String> unavailableSources = List.of();
        private Instant createdAt;

        public Builder anomalyId(String anomalyId) {
            this.anomalyId = anomalyId;
            return this;
        }

        public Builder rootCauses(List<String> rootCauses) {
            this.rootCauses = Objects.requireNonNull(rootCauses);
            return this;
        }

        public Builder matchedRules(List<RcaRule> matchedRules) {
            this.matchedRules = Objects.requireNonNull(matchedRules);
            return this;
        }

        public Builder correlatedAnomalies(List<String> correlatedAnomalies) {
            this.correlatedAnomalies = Objects.requireNonNull(correlatedAnomalies);
            return this;
        }

        public Builder llmAnalysis(String llmAnalysis) {
            this.llmAnalysis = llmAnalysis;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder suggestedActions(List<SuggestedAction> suggestedActions) {
            this.suggestedActions = Objects.requireNonNull(suggestedActions);
            return this;
        }

        public Builder unavailableSources(List<String> unavailableSources) {
            this.unavailableSources = Objects.requireNonNull(unavailableSources);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public RcaResult build() {
            if (confidence < 0 || confidence > 1) {
                throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
            }
            return new RcaResult(this);
        }
    }
}
