package com.metricsentinel.core.knowledge;

import java.util.Objects;

/**
 * A knowledge item with its similarity to a query.
 *
 * @param <T> item type
 * @since 1.0.0
 */
public final class SearchResult<T extends KnowledgeItem> {

    private final T item;
    private final double score;

    public SearchResult(T item, double score) {
        this.item = Objects.requireNonNull(item, "item must not be null");
        this.score = score;
    }

    public T getItem() {
        return item;
    }

    public double getScore() {
        return score;
    }

    public ItemType getItemType() {
        return item.type();
    }

    @Override
    public String toString() {
        return "SearchResult{" + item.getId() + ", score=" + score + '}';
    }
}
