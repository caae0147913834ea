package com.metricsentinel.core.knowledge;

/**
 * Point-in-time counters of a {@link KnowledgeBase}.
 *
 * @since 1.0.0
 */
public final class KnowledgeBaseStats {

    private final boolean vectorIndexEnabled;
    private final boolean embeddingsEnabled;
    private final String collection;
    private final int incidentCount;
    private final int runbookCount;

    public KnowledgeBaseStats(boolean vectorIndexEnabled, boolean embeddingsEnabled, String collection,
            int incidentCount, int runbookCount) {
        this.vectorIndexEnabled = vectorIndexEnabled;
        this.embeddingsEnabled = embeddingsEnabled;
        this.collection = collection;
        this.incidentCount = incidentCount;
        this.runbookCount = runbookCount;
    }

    /** @return {@code true} once {@link KnowledgeBase#initialize()} has reached the index */
    public boolean isVectorIndexEnabled() {
        return vectorIndexEnabled;
    }

    public boolean isEmbeddingsEnabled() {
        return embeddingsEnabled;
    }

    public String getCollection() {
        return collection;
    }

    public int getIncidentCount() {
        return incidentCount;
    }

    public int getRunbookCount() {
        return runbookCount;
    }

    @Override
    public String toString() {
        return "KnowledgeBaseStats{vectorIndexEnabled=" + vectorIndexEnabled
                + ", embeddingsEnabled=" + embeddingsEnabled
                + ", collection=" + collection
                + ", incidents=" + incidentCount
                + ", runbooks=" + runbookCount + '}';
    }
}
