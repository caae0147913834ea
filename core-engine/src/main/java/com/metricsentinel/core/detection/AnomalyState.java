package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.Anomaly;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of currently active anomalies, at most one per metric key.
 *
 * <p>
 * All access goes through a single lock so detection workers may upsert and
 * resolve different keys concurrently. A bounded history of resolved
 * anomalies is kept for operator tooling. The registry is in-memory only.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyState {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Anomaly> active = new LinkedHashMap<>();
    private final Deque<Anomaly> resolvedHistory = new ArrayDeque<>();
    private final int historyLimit;
    private Instant lastUpdated;

    public AnomalyState(int historyLimit) {
        if (historyLimit < 0) {
            throw new IllegalArgumentException("historyLimit must be >= 0, got: " + historyLimit);
        }
        this.historyLimit = historyLimit;
    }

    /**
     * Insert {@code detected}, or refresh the active anomaly for the same key
     * in place.
     *
     * @return the anomaly now registered for the key: the existing instance
     *         (keeping its id and {@code startedAt}) or {@code detected}
     */
    public Anomaly upsert(Anomaly detected) {
        Objects.requireNonNull(detected, "anomaly must not be null");
        lock.lock();
        try {
            String key = detected.metricKey();
            Anomaly existing = active.get(key);
            Anomaly current;
            if (existing != null) {
                existing.refreshFrom(detected);
                current = existing;
            } else {
                detected.updateDuration(detected.getDetectedAt());
                active.put(key, detected);
                current = detected;
            }
            lastUpdated = detected.getDetectedAt();
            return current;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Anomaly> get(String metricKey) {
        lock.lock();
        try {
            return Optional.ofNullable(active.get(metricKey));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove the active anomaly for {@code metricKey} and record it as resolved.
     *
     * @return the resolved anomaly, or empty if none was active
     */
    public Optional<Anomaly> resolve(String metricKey, Instant at) {
        lock.lock();
        try {
            Anomaly anomaly = active.remove(metricKey);
            if (anomaly == null) {
                return Optional.empty();
            }
            anomaly.resolve(at);
            if (historyLimit > 0) {
                resolvedHistory.addLast(anomaly);
                while (resolvedHistory.size() > historyLimit) {
                    resolvedHistory.pollFirst();
                }
            }
            lastUpdated = at;
            return Optional.of(anomaly);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if an active anomaly with {@code id} was found
     */
    public boolean acknowledge(String id, String by) {
        lock.lock();
        try {
            for (Anomaly anomaly : active.values()) {
                if (anomaly.getId().equals(id)) {
                    anomaly.acknowledge(by);
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /** @return snapshot of the active anomalies in insertion order */
    public List<Anomaly> activeAnomalies() {
        lock.lock();
        try {
            return new ArrayList<>(active.values());
        } finally {
            lock.unlock();
        }
    }

    /** @return snapshot of recently resolved anomalies, oldest first */
    public List<Anomaly> resolvedAnomalies() {
        lock.lock();
        try {
            return new ArrayList<>(resolvedHistory);
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return active.size();
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> lastUpdated() {
        lock.lock();
        try {
            return Optional.ofNullable(lastUpdated);
        } finally {
            lock.unlock();
        }
    }
}
