package com.metricsentinel.core.knowledge;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Base class of records held by the {@link KnowledgeBase}.
 *
 * <p>
 * Subclasses define the text that is embedded, the text that keyword search
 * runs against, and the payload stored alongside the vector.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class KnowledgeItem {

    private final String id;
    private final String title;
    private final String description;
    private final List<String> tags;
    private volatile double[] embedding;

    protected KnowledgeItem(String id, String title, String description, List<String> tags) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.description = description != null ? description : "";
        this.tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public abstract ItemType type();

    /** @return text the embedding is generated from */
    public abstract String embeddingText();

    /** @return text the keyword fallback search matches against */
    public abstract String searchText();

    /** @return fields stored with the vector, including {@code type} and {@code id} */
    public abstract Map<String, Object> toPayload();

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getTags() {
        return tags;
    }

    /** @return a copy of the last generated embedding, or {@code null} if none */
    public double[] getEmbedding() {
        double[] current = embedding;
        return current != null ? current.clone() : null;
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    void setEmbedding(double[] embedding) {
        this.embedding = embedding != null ? embedding.clone() : null;
    }

    protected static String newId(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }

    // ---------------------------------------------------------------
    // Payload helpers
    // ---------------------------------------------------------------

    /**
     * @throws IllegalArgumentException if the key is missing or not a string
     */
    protected static String requireString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (!(value instanceof String s)) {
            throw new IllegalArgumentException("payload field '" + key + "' missing or not a string");
        }
        return s;
    }

    protected static String optionalString(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value instanceof String s ? s : null;
    }

    protected static List<String> stringList(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object o : list) {
            if (o != null) {
                result.add(o.toString());
            }
        }
        return result;
    }

    protected static int intValue(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (!(value instanceof Number n)) {
            throw new IllegalArgumentException("payload field '" + key + "' missing or not a number");
        }
        return n.intValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return id.equals(((KnowledgeItem) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        double[] current = embedding;
        return getClass().getSimpleName() + "{id='" + id + "', title='" + title + "', dimensions="
                + (current != null ? current.length : 0) + '}';
    }
}
