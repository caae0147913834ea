package com.metricsentinel.core.knowledge;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A past production incident, consulted when a similar anomaly occurs.
 *
 * @since 1.0.0
 */
public final class Incident extends KnowledgeItem {

    private final String rootCause;
    private final String resolution;
    private final List<String> metricsAffected;
    private final List<String> servicesAffected;
    private final String severity;
    private final int durationMinutes;
    private final Instant occurredAt;
    private final Instant resolvedAt;
    private final String runbookUrl;

    private Incident(Builder b) {
        super(b.id != null ? b.id : newId("INC-"), b.title, b.description, b.tags);
        this.rootCause = Objects.requireNonNull(b.rootCause, "rootCause must not be null");
        this.resolution = b.resolution != null ? b.resolution : "";
        this.metricsAffected = b.metricsAffected != null ? List.copyOf(b.metricsAffected) : List.of();
        this.servicesAffected = b.servicesAffected != null ? List.copyOf(b.servicesAffected) : List.of();
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.durationMinutes = b.durationMinutes;
        this.occurredAt = Objects.requireNonNull(b.occurredAt, "occurredAt must not be null");
        this.resolvedAt = b.resolvedAt;
        this.runbookUrl = b.runbookUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Rebuild an incident from a vector-index payload.
     *
     * @throws IllegalArgumentException if a required field is missing or malformed
     */
    static Incident fromPayload(Map<String, Object> payload) {
        try {
            String resolved = optionalString(payload, "resolved_at");
            return builder()
                    .id(requireString(payload, "id"))
                    .title(requireString(payload, "title"))
                    .description(requireString(payload, "description"))
                    .rootCause(requireString(payload, "root_cause"))
                    .resolution(requireString(payload, "resolution"))
                    .metricsAffected(stringList(payload, "metrics_affected"))
                    .servicesAffected(stringList(payload, "services_affected"))
                    .severity(requireString(payload, "severity"))
                    .durationMinutes(intValue(payload, "duration_minutes"))
                    .occurredAt(Instant.parse(requireString(payload, "occurred_at")))
                    .resolvedAt(resolved != null ? Instant.parse(resolved) : null)
                    .tags(stringList(payload, "tags"))
                    .runbookUrl(optionalString(payload, "runbook_url"))
                    .build();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("payload timestamp is malformed: " + e.getParsedString(), e);
        }
    }

    @Override
    public ItemType type() {
        return ItemType.INCIDENT;
    }

    @Override
    public String embeddingText() {
        return getTitle() + " " + getDescription() + " " + rootCause + " " + resolution;
    }

    @Override
    public String searchText() {
        return getTitle() + " " + getDescription() + " " + rootCause;
    }

    @Override
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type().id());
        payload.put("id", getId());
        payload.put("title", getTitle());
        payload.put("description", getDescription());
        payload.put("root_cause", rootCause);
        payload.put("resolution", resolution);
        payload.put("metrics_affected", metricsAffected);
        payload.put("services_affected", servicesAffected);
        payload.put("severity", severity);
        payload.put("duration_minutes", durationMinutes);
        payload.put("occurred_at", occurredAt.toString());
        if (resolvedAt != null) {
            payload.put("resolved_at", resolvedAt.toString());
        }
        payload.put("tags", getTags());
        if (runbookUrl != null) {
            payload.put("runbook_url", runbookUrl);
        }
        return payload;
    }

    public String getRootCause() {
        return rootCause;
    }

    public String getResolution() {
        return resolution;
    }

    public List<String> getMetricsAffected() {
        return metricsAffected;
    }

    public List<String> getServicesAffected() {
        return servicesAffected;
    }

    public String getSeverity() {
        return severity;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public String getRunbookUrl() {
        return runbookUrl;
    }

    public static final class Builder {
        private String id;
        private String title;
        private String description;
        private String rootCause;
        private String resolution;
        private List<String> metricsAffected;
        private List<String> servicesAffected;
        private String severity;
        private int durationMinutes;
        private Instant occurredAt;
        private Instant resolvedAt;
        private List<String> tags;
        private String runbookUrl;

        /** Optional; a random {@code INC-xxxxxxxx} id is generated when unset. */
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

        public Builder rootCause(String rootCause) {
            this.rootCause = rootCause;
            return this;
        }

        public Builder resolution(String resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder metricsAffected(List<String> metricsAffected) {
            this.metricsAffected = metricsAffected;
            return this;
        }

        public Builder servicesAffected(List<String> servicesAffected) {
            this.servicesAffected = servicesAffected;
            return this;
        }

        public Builder severity(String severity) {
            this.severity = severity;
            return this;
        }

        public Builder durationMinutes(int durationMinutes) {
            this.durationMinutes = durationMinutes;
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder runbookUrl(String runbookUrl) {
            this.runbookUrl = runbookUrl;
            return this;
        }

        public Incident build() {
            return new Incident(this);
        }
    }
}
