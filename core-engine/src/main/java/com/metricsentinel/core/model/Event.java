package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Cluster or platform event (for example a Kubernetes event) as returned by
 * the event store.
 *
 * <p>
 * {@code reason} is the machine-readable event type (e.g. {@code OOMKilled},
 * {@code BackOff}) that RCA rules match against.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Event {

    private String kind;
    private String name;
    private String reason;
    private String message;
    private Instant timestamp;

    /** No-arg constructor required by Jackson. */
    public Event() {
    }

    private Event(Builder b) {
        this.kind = b.kind;
        this.name = b.name;
        this.reason = b.reason;
        this.message = b.message;
        this.timestamp = b.timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String kind;
        private String name;
        private String reason;
        private String message;
        private Instant timestamp;

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Event build() {
            return new Event(this);
        }
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * @return {@code kind/name: reason}
     */
    public String summary() {
        return kind + "/" + name + ": " + reason;
    }

    @Override
    public String toString() {
        return "Event{" + summary() + '}';
    }
}
