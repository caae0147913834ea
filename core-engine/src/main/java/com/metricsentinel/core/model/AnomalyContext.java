package com.metricsentinel.core.model;

import java.util.List;

/**
 * Evidence gathered around an anomaly by root-cause analysis and the
 * knowledge base. Immutable; use the {@code with*} methods to derive updated
 * copies.
 *
 * @since 1.0.0
 */
public final class AnomalyContext {

    private static final AnomalyContext EMPTY =
            new AnomalyContext(List.of(), List.of(), List.of(), List.of(), List.of());

    private final List<String> relatedMetrics;
    private final List<String> recentEvents;
    private final List<String> logPatterns;
    private final List<String> potentialCauses;
    private final List<String> similarIncidents;

    public AnomalyContext(List<String> relatedMetrics, List<String> recentEvents, List<String> logPatterns,
            List<String> potentialCauses, List<String> similarIncidents) {
        this.relatedMetrics = copy(relatedMetrics);
        this.recentEvents = copy(recentEvents);
        this.logPatterns = copy(logPatterns);
        this.potentialCauses = copy(potentialCauses);
        this.similarIncidents = copy(similarIncidents);
    }

    public static AnomalyContext empty() {
        return EMPTY;
    }

    public List<String> getRelatedMetrics() {
        return relatedMetrics;
    }

    /**
     * @return event summaries formatted as {@code kind/name: reason}
     */
    public List<String> getRecentEvents() {
        return recentEvents;
    }

    public List<String> getLogPatterns() {
        return logPatterns;
    }

    public List<String> getPotentialCauses() {
        return potentialCauses;
    }

    /**
     * @return ids of similar historical incidents, filled by the knowledge base
     */
    public List<String> getSimilarIncidents() {
        return similarIncidents;
    }

    public AnomalyContext withSimilarIncidents(List<String> incidents) {
        return new AnomalyContext(relatedMetrics, recentEvents, logPatterns, potentialCauses, incidents);
    }

    private static List<String> copy(List<String> list) {
        return list != null ? List.copyOf(list) : List.of();
    }

    @Override
    public String toString() {
        return "AnomalyContext{" +
                "relatedMetrics=" + relatedMetrics +
                ", recentEvents=" + recentEvents +
                ", logPatterns=" + logPatterns +
                ", potentialCauses=" + potentialCauses +
                ", similarIncidents=" + similarIncidents +
                '}';
    }
}
