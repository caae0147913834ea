package com.metricsentinel.core.knowledge;

import com.metricsentinel.core.config.SentinelConfig;
import com.metricsentinel.core.model.Anomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Incident and runbook store with vector-or-keyword similarity search.
 *
 * <h3>Writes</h3>
 * <p>
 * An item is embedded and upserted into the vector index on a best-effort
 * basis. Whatever happens there, it is then stored in the local cache, which
 * is the source of truth for lookups and for the keyword fallback.
 * </p>
 *
 * <h3>Reads</h3>
 * <p>
 * With an initialized index and an embedding service, the query is embedded
 * and searched in the index, filtered by item type, keeping hits with
 * {@code score >= minScore}. If that is unavailable, fails, returns a
 * malformed payload or yields nothing, the local cache is ranked by
 * {@link KeywordSimilarity} instead.
 * </p>
 *
 * <p>
 * No public method throws for collaborator failures.
 * </p>
 *
 * @since 1.0.0
 */
public class KnowledgeBase {

    private static final Logger LOG = LoggerFactory.getLogger(KnowledgeBase.class);

    public static final int DEFAULT_INCIDENT_LIMIT = 5;
    public static final int DEFAULT_RUNBOOK_LIMIT = 3;
    public static final double DEFAULT_MIN_SCORE = 0.5;

    private final EmbeddingService embeddings;
    private final VectorIndex vectorIndex;
    private final String collection;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Incident> incidents = new LinkedHashMap<>();
    private final Map<String, Runbook> runbooks = new LinkedHashMap<>();
    private volatile boolean vectorEnabled;

    /**
     * @param embeddings  embedding service, {@code null} for keyword search only
     * @param vectorIndex vector index, {@code null} for keyword search only
     * @param collection  collection name reported in {@link #getStats()}
     */
    public KnowledgeBase(EmbeddingService embeddings, VectorIndex vectorIndex, String collection) {
        this.embeddings = embeddings;
        this.vectorIndex = vectorIndex;
        this.collection = collection;
    }

    /**
     * Wire the collaborators named by {@code config} and call {@link #initialize()}.
     * The pseudo-embedding service is used only when offline embeddings are
     * explicitly enabled.
     */
    public static KnowledgeBase fromConfig(SentinelConfig config) {
        EmbeddingService embeddings = null;
        if (config.isOfflineEmbeddings()) {
            embeddings = new PseudoEmbeddingService(config.getEmbeddingDimensions());
        } else if (config.isEmbeddingConfigured()) {
            embeddings = HttpEmbeddingService.fromConfig(config);
        }
        VectorIndex index = config.isVectorIndexConfigured() ? QdrantVectorIndex.fromConfig(config) : null;

        KnowledgeBase kb = new KnowledgeBase(embeddings, index, config.getQdrantCollection());
        kb.initialize();
        return kb;
    }

    /**
     * Make sure the vector collection exists. On failure the index stays
     * disabled and all searches use the local cache.
     *
     * @return {@code true} if the vector index is usable
     */
    public boolean initialize() {
        if (vectorIndex == null || embeddings == null) {
            LOG.info("Knowledge base using local storage only: vectorIndex={} embeddings={}",
                    vectorIndex != null, embeddings != null);
            vectorEnabled = false;
            return false;
        }
        try {
            vectorIndex.ensureCollection(embeddings.dimensions());
            vectorEnabled = true;
            LOG.info("Knowledge base initialized: collection={}", collection);
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Vector index unavailable, using local storage: collection={} error={}",
                    collection, e.toString());
            vectorEnabled = false;
            return false;
        }
    }

    // ---------------------------------------------------------------
    // Writes
    // ---------------------------------------------------------------

    /**
     * @return the incident id
     */
    public String addIncident(Incident incident) {
        Objects.requireNonNull(incident, "incident must not be null");
        store(incident);
        lock.lock();
        try {
            incidents.put(incident.getId(), incident);
        } finally {
            lock.unlock();
        }
        LOG.info("Added incident: id={} title={} embedded={}",
                incident.getId(), incident.getTitle(), incident.hasEmbedding());
        return incident.getId();
    }

    /**
     * @return the runbook id
     */
    public String addRunbook(Runbook runbook) {
        Objects.requireNonNull(runbook, "runbook must not be null");
        store(runbook);
        lock.lock();
        try {
            runbooks.put(runbook.getId(), runbook);
        } finally {
            lock.unlock();
        }
        LOG.info("Added runbook: id={} title={} embedded={}",
                runbook.getId(), runbook.getTitle(), runbook.hasEmbedding());
        return runbook.getId();
    }

    private void store(KnowledgeItem item) {
        double[] vector = embed(item.embeddingText());
        item.setEmbedding(vector);
        if (vector == null || !vectorEnabled) {
            return;
        }
        try {
            vectorIndex.upsert(item.getId(), vector, item.toPayload());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to store {} in vector index: id={} error={}",
                    item.type().id(), item.getId(), e.toString());
        }
    }

    // ---------------------------------------------------------------
    // Reads
    // ---------------------------------------------------------------

    public List<SearchResult<Incident>> searchSimilarIncidents(String query) {
        return searchSimilarIncidents(query, DEFAULT_INCIDENT_LIMIT, DEFAULT_MIN_SCORE);
    }

    public List<SearchResult<Incident>> searchSimilarIncidents(String query, int limit, double minScore) {
        return search(query, ItemType.INCIDENT, limit, minScore, Incident::fromPayload, snapshot(incidents));
    }

    public List<SearchResult<Runbook>> searchRunbooks(String query) {
        return searchRunbooks(query, DEFAULT_RUNBOOK_LIMIT, DEFAULT_MIN_SCORE);
    }

    public List<SearchResult<Runbook>> searchRunbooks(String query, int limit, double minScore) {
        return search(query, ItemType.RUNBOOK, limit, minScore, Runbook::fromPayload, snapshot(runbooks));
    }

    /**
     * Search incidents with a natural-language description of an anomaly.
     */
    public List<SearchResult<Incident>> findSimilarToAnomaly(String metricName, double deviation, String severity,
            int limit) {
        return searchSimilarIncidents(anomalyQuery(metricName, deviation, severity), limit, DEFAULT_MIN_SCORE);
    }

    /**
     * Fill the anomaly's similar-incidents context with {@code id: title}
     * entries of the closest incidents.
     *
     * @return the incidents found
     */
    public List<SearchResult<Incident>> enrichAnomaly(Anomaly anomaly, int limit) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        List<SearchResult<Incident>> similar = findSimilarToAnomaly(anomaly.getMetricName(),
                anomaly.getDeviation(), anomaly.getSeverity().label(), limit);
        List<String> references = similar.stream()
                .map(r -> r.getItem().getId() + ": " + r.getItem().getTitle())
                .toList();
        anomaly.setContext(anomaly.getContext().withSimilarIncidents(references));
        return similar;
    }

    public Optional<Incident> getIncident(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(incidents.get(id));
        } finally {
            lock.unlock();
        }
    }

    public Optional<Runbook> getRunbook(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(runbooks.get(id));
        } finally {
            lock.unlock();
        }
    }

    public KnowledgeBaseStats getStats() {
        lock.lock();
        try {
            return new KnowledgeBaseStats(vectorEnabled, embeddings != null, collection,
                    incidents.size(), runbooks.size());
        } finally {
            lock.unlock();
        }
    }

    static String anomalyQuery(String metricName, double deviation, String severity) {
        return String.format(Locale.ROOT, "anomaly in %s with %.1f sigma deviation severity %s",
                metricName, Math.abs(deviation), severity);
    }

    // ---------------------------------------------------------------
    // Search internals
    // ---------------------------------------------------------------

    private <T extends KnowledgeItem> List<SearchResult<T>> search(String query, ItemType type, int limit,
            double minScore, Function<Map<String, Object>, T> fromPayload, List<T> local) {
        if (query == null || limit <= 0) {
            return List.of();
        }
        List<SearchResult<T>> results = vectorSearch(query, type, limit, minScore, fromPayload);
        if (results.isEmpty()) {
            results = keywordSearch(query, limit, minScore, local);
        }
        return results;
    }

    private <T extends KnowledgeItem> List<SearchResult<T>> vectorSearch(String query, ItemType type, int limit,
            double minScore, Function<Map<String, Object>, T> fromPayload) {
        if (!vectorEnabled) {
            return List.of();
        }
        double[] vector = embed(query);
        if (vector == null) {
            return List.of();
        }
        try {
            List<SearchResult<T>> results = new ArrayList<>();
            for (VectorMatch match : vectorIndex.search(vector, type, limit)) {
                if (match.getScore() >= minScore) {
                    results.add(new SearchResult<>(fromPayload.apply(match.getPayload()), match.getScore()));
                }
            }
            return results;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Vector search failed, falling back to keyword search: type={} error={}",
                    type.id(), e.toString());
            return List.of();
        }
    }

    static <T extends KnowledgeItem> List<SearchResult<T>> keywordSearch(String query, int limit, double minScore,
            List<T> candidates) {
        Set<String> queryWords = KeywordSimilarity.words(query);
        List<SearchResult<T>> results = new ArrayList<>();
        for (T item : candidates) {
            double score = KeywordSimilarity.score(queryWords, item.searchText());
            if (score >= minScore) {
                results.add(new SearchResult<>(item, score));
            }
        }
        results.sort(Comparator.comparingDouble((SearchResult<T> r) -> r.getScore()).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private double[] embed(String text) {
        if (embeddings == null) {
            return null;
        }
        try {
            return embeddings.embed(text);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Embedding generation failed: error={}", e.toString());
            return null;
        }
    }

    private <T> List<T> snapshot(Map<String, T> cache) {
        lock.lock();
        try {
            return new ArrayList<>(cache.values());
        } finally {
            lock.unlock();
        }
    }
}
