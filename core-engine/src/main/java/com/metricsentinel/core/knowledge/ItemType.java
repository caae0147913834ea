package com.metricsentinel.core.knowledge;

/**
 * Kind of knowledge item. The id is stored in the vector payload and used as
 * the search filter.
 *
 * @since 1.0.0
 */
public enum ItemType {
    INCIDENT("incident"),
    RUNBOOK("runbook");

    private final String id;

    ItemType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
