package com.metricsentinel.core.rca;

/**
 * Remediation step attached to an RCA rule. Lower priority values are more
 * urgent.
 *
 * @since 1.0.0
 */
public class RemediationAction {

    private String action;
    private String target;
    private int priority = 1;

    public RemediationAction() {
    }

    public RemediationAction(String action, String target, int priority) {
        this.action = action;
        this.target = target;
        this.priority = priority;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getTarget() {
        return target;
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    /** @return {@code action:target}, the identity used for deduplication */
    public String dedupKey() {
        return action + ":" + target;
    }

    @Override
    public String toString() {
        return "RemediationAction{" + dedupKey() + ", priority=" + priority + '}';
    }
}
