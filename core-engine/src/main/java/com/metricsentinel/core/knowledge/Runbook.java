package com.metricsentinel.core.knowledge;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operational procedure with the conditions that should trigger it.
 *
 * @since 1.0.0
 */
public final class Runbook extends KnowledgeItem {

    private final List<String> triggerConditions;
    private final List<String> steps;

    private Runbook(Builder b) {
        super(b.id != null ? b.id : newId("RB-"), b.title, b.description, b.tags);
        this.triggerConditions = b.triggerConditions != null ? List.copyOf(b.triggerConditions) : List.of();
        this.steps = b.steps != null ? List.copyOf(b.steps) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws IllegalArgumentException if a required field is missing
     */
    static Runbook fromPayload(Map<String, Object> payload) {
        return builder()
                .id(requireString(payload, "id"))
                .title(requireString(payload, "title"))
                .description(requireString(payload, "description"))
                .triggerConditions(stringList(payload, "trigger_conditions"))
                .steps(stringList(payload, "steps"))
                .tags(stringList(payload, "tags"))
                .build();
    }

    @Override
    public ItemType type() {
        return ItemType.RUNBOOK;
    }

    @Override
    public String embeddingText() {
        return searchText();
    }

    @Override
    public String searchText() {
        return getTitle() + " " + getDescription() + " " + String.join(" ", triggerConditions);
    }

    @Override
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type().id());
        payload.put("id", getId());
        payload.put("title", getTitle());
        payload.put("description", getDescription());
        payload.put("trigger_conditions", triggerConditions);
        payload.put("steps", steps);
        payload.put("tags", getTags());
        return payload;
    }

    public List<String> getTriggerConditions() {
        return triggerConditions;
    }

    public List<String> getSteps() {
        return steps;
    }

    public static final class Builder {
        private String id;
        private String title;
        private String description;
        private List<String> triggerConditions;
        private List<String> steps;
        private List<String> tags;

        /** Optional; a random {@code RB-xxxxxxxx} id is generated when unset. */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder triggerConditions(List<String> triggerConditions) {
            this.triggerConditions = triggerConditions;
            return this;
        }

        public Builder steps(List<String> steps) {
            this.steps = steps;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Runbook build() {
            return new Runbook(this);
        }
    }
}
