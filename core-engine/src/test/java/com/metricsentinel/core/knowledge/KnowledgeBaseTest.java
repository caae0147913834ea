package com.metricsentinel.core.knowledge;

import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalySeverity;
import com.metricsentinel.core.model.AnomalyType;
import com.metricsentinel.core.model.MetricCategory;
import org.assertj.core.groups.Tuple;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link KnowledgeBase}.
 */
class KnowledgeBaseTest {

    private static final Instant OCCURRED = Instant.parse("2024-03-02T14:00:00Z");
    private static final String POOL_QUERY = "database connection pool exhausted";

    @Nested
    @DisplayName("Keyword search only")
    class KeywordOnly {

        private KnowledgeBase kb;

        @BeforeEach
        void setUp() {
            kb = new KnowledgeBase(null, null, "knowledge_base");
        }

        @Test
        @DisplayName("Should report the vector index as unavailable")
        void initializeWithoutCollaborators() {
            assertThat(kb.initialize()).isFalse();
            assertThat(kb.getStats().isVectorIndexEnabled()).isFalse();
            assertThat(kb.getStats().isEmbeddingsEnabled()).isFalse();
        }

        @Test
        @DisplayName("Should rank incidents by query word coverage and drop those below the minimum score")
        void ranksIncidents() {
            kb.addIncident(poolIncident());
            kb.addIncident(incident("INC-2", "Connection storm", "connection count spiked", "retry loop"));
            kb.addIncident(incident("INC-3", "Disk full on logging node", "volume at 100%", "log rotation"));

            List<SearchResult<Incident>> results = kb.searchSimilarIncidents(POOL_QUERY);

            assertThat(results)
                    .extracting(r -> r.getItem().getId(), SearchResult::getScore)
                    .containsExactly(tuple("INC-1", 1.0));
        }

        @Test
        @DisplayName("Should honour the limit and a lower minimum score")
        void limitAndMinScore() {
            kb.addIncident(poolIncident());
            kb.addIncident(incident("INC-2", "Connection storm", "connection count spiked", "retry loop"));
            kb.addIncident(incident("INC-3", "Database failover", "primary database restarted", "hardware"));

            List<SearchResult<Incident>> results = kb.searchSimilarIncidents(POOL_QUERY, 2, 0.2);

            assertThat(results).extracting(r -> r.getItem().getId()).containsExactly("INC-1", "INC-2");
            assertThat(results.get(1).getScore()).isEqualTo(0.25);
        }

        @Test
        @DisplayName("Should search runbooks separately from incidents")
        void searchesRunbooks() {
            kb.addIncident(poolIncident());
            kb.addRunbook(Runbook.builder()
                    .id("RB-1")
                    .title("Scale database connection pool")
                    .description("Raise the pool size when connections are exhausted")
                    .steps(List.of("check pool metrics", "raise max pool size"))
                    .build());

            List<SearchResult<Runbook>> results = kb.searchRunbooks(POOL_QUERY);

            assertThat(results).extracting(r -> r.getItem().getId()).containsExactly("RB-1");
            assertThat(results.get(0).getItemType()).isEqualTo(ItemType.RUNBOOK);
        }

        @Test
        @DisplayName("Should return nothing for a null query or a non-positive limit")
        void degenerateQueries() {
            kb.addIncident(poolIncident());

            assertThat(kb.searchSimilarIncidents(null)).isEmpty();
            assertThat(kb.searchSimilarIncidents(POOL_QUERY, 0, 0.0)).isEmpty();
        }

        @Test
        @DisplayName("Should list similar incidents on the anomaly as id and title")
        void enrichesAnomaly() {
            kb.addIncident(incident("INC-9", "Critical anomaly in api_latency_p99",
                    "sigma deviation far above baseline", "slow query"));
            Anomaly anomaly = anomaly(-3.24);

            List<SearchResult<Incident>> similar = kb.enrichAnomaly(anomaly, 3);

            assertThat(similar).hasSize(1);
            assertThat(anomaly.getContext().getSimilarIncidents())
                    .containsExactly("INC-9: Critical anomaly in api_latency_p99");
        }

        @Test
        @DisplayName("Should look items up by id and count them in the stats")
        void lookupsAndStats() {
            String id = kb.addIncident(poolIncident());
            kb.addRunbook(Runbook.builder().title("Restart pods").build());

            assertThat(kb.getIncident(id)).map(Incident::getTitle).contains("Database connection pool exhausted");
            assertThat(kb.getIncident("INC-missing")).isEmpty();
            assertThat(kb.getRunbook("RB-missing")).isEmpty();

            KnowledgeBaseStats stats = kb.getStats();
            assertThat(stats.getIncidentCount()).isEqualTo(1);
            assertThat(stats.getRunbookCount()).isEqualTo(1);
            assertThat(stats.getCollection()).isEqualTo("knowledge_base");
        }
    }

    @Nested
    @DisplayName("With a vector index")
    class WithVectorIndex {

        private final double[] vector = {0.6, 0.8};

        private EmbeddingService embeddings;
        private VectorIndex index;
        private KnowledgeBase kb;

        @BeforeEach
        void setUp() throws IOException {
            embeddings = mock(EmbeddingService.class);
            index = mock(VectorIndex.class);
            when(embeddings.dimensions()).thenReturn(2);
            when(embeddings.embed(anyString())).thenReturn(vector);
            kb = new KnowledgeBase(embeddings, index, "knowledge_base");
        }

        @Test
        @DisplayName("Should create the collection and upsert added items")
        void upsertsItems() throws Exception {
            assertThat(kb.initialize()).isTrue();
            Incident incident = poolIncident();

            kb.addIncident(incident);

            verify(index).ensureCollection(2);
            verify(index).upsert(eq("INC-1"), eq(vector), eq(incident.toPayload()));
            assertThat(incident.getEmbedding()).containsExactly(vector);
        }

        @Test
        @DisplayName("Should return vector hits at or above the minimum score, rebuilt from their payload")
        void vectorHits() throws Exception {
            kb.initialize();
            Incident stored = poolIncident();
            when(index.search(vector, ItemType.INCIDENT, 5)).thenReturn(List.of(
                    new VectorMatch(0.82, stored.toPayload()),
                    new VectorMatch(0.31, incident("INC-2", "Other", "other", "other").toPayload())));

            List<SearchResult<Incident>> results = kb.searchSimilarIncidents("pool trouble");

            assertThat(results).extracting(r -> r.getItem().getId(), SearchResult::getScore)
                    .containsExactly(tuple("INC-1", 0.82));
            Incident rebuilt = results.get(0).getItem();
            assertThat(rebuilt.getRootCause()).isEqualTo(stored.getRootCause());
            assertThat(rebuilt.getOccurredAt()).isEqualTo(OCCURRED);
            assertThat(rebuilt.getMetricsAffected()).containsExactly("db_connections_active");
        }

        @Test
        @DisplayName("Should fall back to the keyword ranking when the index returns nothing")
        void emptyVectorResult() throws Exception {
            kb.initialize();
            Incident incident = poolIncident();
            kb.addIncident(incident);
            when(index.search(any(), eq(ItemType.INCIDENT), anyInt())).thenReturn(List.of());

            List<SearchResult<Incident>> results = kb.searchSimilarIncidents(POOL_QUERY);

            assertThat(results).extracting(r -> r.getItem().getId(), SearchResult::getScore)
                    .containsExactlyElementsOf(keywordRanking(List.of(incident)));
        }

        @Test
        @DisplayName("Should fall back to the keyword ranking when a payload is malformed")
        void malformedPayload() throws Exception {
            kb.initialize();
            Incident incident = poolIncident();
            kb.addIncident(incident);
            when(index.search(any(), eq(ItemType.INCIDENT), anyInt()))
                    .thenReturn(List.of(new VectorMatch(0.95, Map.of("type", "incident", "id", "INC-1"))));

            List<SearchResult<Incident>> results = kb.searchSimilarIncidents(POOL_QUERY);

            assertThat(results).extracting(r -> r.getItem().getId(), SearchResult::getScore)
                    .containsExactlyElementsOf(keywordRanking(List.of(incident)));
        }

        @Test
        @DisplayName("Should fall back to the keyword ranking when the index search fails")
        void searchFailure() throws Exception {
            kb.initialize();
            kb.addIncident(poolIncident());
            when(index.search(any(), any(), anyInt())).thenThrow(new IOException("connection refused"));

            assertThat(kb.searchSimilarIncidents(POOL_QUERY))
                    .extracting(r -> r.getItem().getId())
                    .containsExactly("INC-1");
        }

        @Test
        @DisplayName("Should still cache an item whose upsert fails")
        void upsertFailure() throws Exception {
            kb.initialize();
            doThrow(new IOException("timeout")).when(index).upsert(anyString(), any(), any());

            String id = kb.addIncident(poolIncident());

            assertThat(kb.getIncident(id)).isPresent();
            assertThat(kb.getIncident(id).orElseThrow().hasEmbedding()).isTrue();
        }

        @Test
        @DisplayName("Should cache an item without embedding when embedding fails")
        void embeddingFailure() throws Exception {
            kb.initialize();
            when(embeddings.embed(anyString())).thenThrow(new IOException("quota exceeded"));

            String id = kb.addIncident(poolIncident());

            assertThat(kb.getIncident(id).orElseThrow().hasEmbedding()).isFalse();
            verify(index, never()).upsert(anyString(), any(), any());
            assertThat(kb.searchSimilarIncidents(POOL_QUERY)).hasSize(1);
        }

        @Test
        @DisplayName("Should stay on keyword search when the collection cannot be created")
        void initializeFailure() throws Exception {
            doThrow(new IOException("qdrant down")).when(index).ensureCollection(anyInt());

            assertThat(kb.initialize()).isFalse();
            kb.addIncident(poolIncident());

            assertThat(kb.searchSimilarIncidents(POOL_QUERY)).hasSize(1);
            verify(index, never()).search(any(), any(), anyInt());
            verify(index, never()).upsert(anyString(), any(), any());
            assertThat(kb.getStats().isVectorIndexEnabled()).isFalse();
            assertThat(kb.getStats().isEmbeddingsEnabled()).isTrue();
        }

        @Test
        @DisplayName("Should not query the index before initialization")
        void notInitialized() throws Exception {
            kb.addIncident(poolIncident());

            assertThat(kb.searchSimilarIncidents(POOL_QUERY)).hasSize(1);
            verify(index, never()).search(any(), any(), anyInt());
        }
    }

    @Test
    @DisplayName("Should describe an anomaly by metric, absolute deviation and severity")
    void anomalyQuery() {
        assertThat(KnowledgeBase.anomalyQuery("api_latency_p99", -3.24, "critical"))
                .isEqualTo("anomaly in api_latency_p99 with 3.2 sigma deviation severity critical");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static List<Tuple> keywordRanking(List<Incident> candidates) {
        return KnowledgeBase.keywordSearch(POOL_QUERY, KnowledgeBase.DEFAULT_INCIDENT_LIMIT,
                        KnowledgeBase.DEFAULT_MIN_SCORE, candidates).stream()
                .map(r -> tuple(r.getItem().getId(), r.getScore()))
                .toList();
    }

    private static Incident poolIncident() {
        return Incident.builder()
                .id("INC-1")
                .title("Database connection pool exhausted")
                .description("Order API latency spiked while every pooled connection was busy")
                .rootCause("Pool size too small after traffic doubled")
                .resolution("Raised max pool size to 200")
                .metricsAffected(List.of("db_connections_active"))
                .servicesAffected(List.of("order-api"))
                .severity("high")
                .durationMinutes(45)
                .occurredAt(OCCURRED)
                .tags(List.of("database"))
                .build();
    }

    private static Incident incident(String id, String title, String description, String rootCause) {
        return Incident.builder()
                .id(id)
                .title(title)
                .description(description)
                .rootCause(rootCause)
                .severity("medium")
                .occurredAt(OCCURRED)
                .build();
    }

    private static Anomaly anomaly(double deviation) {
        return Anomaly.builder()
                .detectedAt(OCCURRED)
                .metricName("api_latency_p99")
                .category(MetricCategory.API)
                .labels(Map.of("service", "order-api"))
                .currentValue(2.0)
                .baselineValue(0.4)
                .deviation(deviation)
                .deviationPercent(400.0)
                .type(AnomalyType.POINT)
                .severity(AnomalySeverity.CRITICAL)
                .build();
    }
}
