package com.metricsentinel.core.rca;

import com.metricsentinel.core.model.AnomalySeverity;

import java.util.Objects;

/**
 * Remediation step proposed by an RCA run, traced back to the rule that
 * suggested it.
 *
 * @since 1.0.0
 */
public final class SuggestedAction {

    private final String action;
    private final String target;
    private final int priority;
    private final String sourceRuleId;
    private final AnomalySeverity severity;

    public SuggestedAction(String action, String target, int priority, String sourceRuleId,
            AnomalySeverity severity) {
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.priority = priority;
        this.sourceRuleId = sourceRuleId;
        this.severity = severity;
    }

    public String getAction() {
        return action;
    }

    public String getTarget() {
        return target;
    }

    /** @return lower is more urgent */
    public int getPriority() {
        return priority;
    }

    public String getSourceRuleId() {
        return sourceRuleId;
    }

    public AnomalySeverity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        return "SuggestedAction{" + action + ":" + target + ", priority=" + priority
                + ", rule=" + sourceRuleId + ", severity=" + severity + '}';
    }
}
