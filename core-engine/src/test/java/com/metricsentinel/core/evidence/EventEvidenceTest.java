package com.metricsentinel.core.evidence;

import com.metricsentinel.core.model.DataPoint;
import com.metricsentinel.core.model.Event;
import com.metricsentinel.core.model.MetricCategory;
import com.metricsentinel.core.model.MetricSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventEvidence} and {@link CorrelatedValues}.
 */
class EventEvidenceTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:15:00Z");

    @Test
    @DisplayName("Should report the non-empty reasons as event types in input order")
    void shouldExtractEventTypes() {
        List<Event> events = Arrays.asList(
                event("Pod", "api-1", "OOMKilled"),
                null,
                event("Pod", "api-2", ""),
                event("Deployment", "api", "ScalingReplicaSet"));

        assertThat(EventEvidence.eventTypes(events)).containsExactly("OOMKilled", "ScalingReplicaSet");
        assertThat(EventEvidence.eventTypes(null)).isEmpty();
    }

    @Test
    @DisplayName("Should summarize as kind/name: reason and honour the limit")
    void shouldSummarizeEvents() {
        List<Event> events = List.of(
                event("Pod", "api-1", "OOMKilled"),
                event("Pod", "api-2", "BackOff"),
                event("Node", "worker-3", "NodeNotReady"));

        assertThat(EventEvidence.summaries(events, 2))
                .containsExactly("Pod/api-1: OOMKilled", "Pod/api-2: BackOff");
    }

    @Test
    @DisplayName("Should take the latest point of each non-empty series as correlated values")
    void shouldCollectLatestValues() {
        List<MetricSeries> related = Arrays.asList(
                series("db_connections_active", 40.0, 95.0),
                new MetricSeries("empty", MetricCategory.DATABASE, Map.of(), List.of()),
                null,
                series("cpu_usage_percent", 55.0));

        assertThat(CorrelatedValues.latestByName(related))
                .containsExactly(Map.entry("db_connections_active", 95.0), Map.entry("cpu_usage_percent", 55.0));
        assertThat(CorrelatedValues.latestByName(null)).isEmpty();
    }

    private static Event event(String kind, String name, String reason) {
        return Event.builder().kind(kind).name(name).reason(reason).message("").timestamp(NOW).build();
    }

    private static MetricSeries series(String name, double... values) {
        DataPoint[] points = new DataPoint[values.length];
        for (int i = 0; i < values.length; i++) {
            points[i] = new DataPoint(NOW.minusSeconds(60L * (values.length - i)), values[i]);
        }
        return new MetricSeries(name, MetricCategory.DATABASE, Map.of(), List.of(points));
    }
}
