package com.metricsentinel.core.rca;

import com.metricsentinel.core.model.AnomalySeverity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Declarative root-cause hypothesis loaded from the RCA rules YAML.
 *
 * <pre>
 * - id: db-pool-exhaustion
 *   name: Database connection pool exhausted
 *   condition:
 *     primaryMetric: api_latency_p99
 *     primaryThreshold: 1.5
 *     correlatedMetrics:
 *       - metric: db_connections_active
 *         threshold: 90
 *     logPatterns: [timeout, connection refused]
 *   rootCause: Database connection pool is exhausted
 *   severity: high
 *   remediation:
 *     - action: scale_connection_pool
 *       target: order-db
 *       priority: 1
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class RcaRule {

    private String id;
    private String name;
    private RuleCondition condition = new RuleCondition();
    private String rootCause;
    private String severity = "medium";
    private List<RemediationAction> remediation = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String label = id != null ? id : "<unnamed>";

        if (id == null || id.isBlank()) {
            errors.add("Rule 'id' is required");
        }
        if (name == null || name.isBlank()) {
            errors.add("Rule '" + label + "' requires 'name'");
        }
        if (rootCause == null || rootCause.isBlank()) {
            errors.add("Rule '" + label + "' requires 'rootCause'");
        }
        try {
            AnomalySeverity.fromLabel(severity);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + label + "' has invalid severity '" + severity + "'");
        }
        if (condition == null) {
            errors.add("Rule '" + label + "' requires 'condition'");
        } else {
            for (CorrelatedMetric cm : condition.getCorrelatedMetrics()) {
                if (cm == null || cm.getMetric() == null || cm.getMetric().isBlank()) {
                    errors.add("Rule '" + label + "' has a correlated metric without 'metric'");
                }
            }
        }
        for (RemediationAction action : remediation) {
            if (action == null || action.getAction() == null || action.getAction().isBlank()
                    || action.getTarget() == null || action.getTarget().isBlank()) {
                errors.add("Rule '" + label + "' has a remediation step without 'action' or 'target'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / setters (SnakeYAML)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public RuleCondition getCondition() {
        return condition;
    }

    public void setCondition(RuleCondition condition) {
        this.condition = condition;
    }

    public String getRootCause() {
        return rootCause;
    }

    public void setRootCause(String rootCause) {
        this.rootCause = rootCause;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    /**
     * @throws IllegalArgumentException if the severity label is unknown
     */
    public AnomalySeverity getSeverityLevel() {
        return AnomalySeverity.fromLabel(severity);
    }

    public List<RemediationAction> getRemediation() {
        return Collections.unmodifiableList(remediation);
    }

    public void setRemediation(List<RemediationAction> remediation) {
        this.remediation = remediation != null ? new ArrayList<>(remediation) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "RcaRule{id='" + id + "', name='" + name + "', severity=" + severity + '}';
    }
}
