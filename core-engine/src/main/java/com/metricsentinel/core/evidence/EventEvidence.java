package com.metricsentinel.core.evidence;

import com.metricsentinel.core.model.Event;

import java.util.List;
import java.util.Objects;

/**
 * Extracts rule-matchable evidence from cluster events.
 *
 * @since 1.0.0
 */
public final class EventEvidence {

    private EventEvidence() {
        // utility class
    }

    /**
     * @return the non-empty {@code reason} of every event, in input order
     */
    public static List<String> eventTypes(List<Event> events) {
        if (events == null) {
            return List.of();
        }
        return events.stream()
                .filter(Objects::nonNull)
                .map(Event::getReason)
                .filter(reason -> reason != null && !reason.isEmpty())
                .toList();
    }

    /**
     * @param limit maximum number of summaries
     * @return {@code kind/name: reason} for the first {@code limit} events
     */
    public static List<String> summaries(List<Event> events, int limit) {
        if (events == null) {
            return List.of();
        }
        return events.stream()
                .filter(Objects::nonNull)
                .limit(Math.max(0, limit))
                .map(Event::summary)
                .toList();
    }
}
