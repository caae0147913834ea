package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Objects;

/**
 * One log line as returned by the log store.
 *
 * <p>
 * Has a no-arg constructor and setters so log-store adapters can bind JSON
 * responses with Jackson; use the {@link Builder} elsewhere.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogEntry {

    private String message = "";
    private LogLevel level = LogLevel.INFO;
    private String service;
    /** Explicit error code attached by the emitting service, if any. */
    private String errorCode;
    private Instant timestamp;

    /** No-arg constructor required by Jackson. */
    public LogEntry() {
    }

    private LogEntry(Builder b) {
        this.message = Objects.requireNonNull(b.message, "message must not be null");
        this.level = b.level != null ? b.level : LogLevel.INFO;
        this.service = b.service;
        this.errorCode = b.errorCode;
        this.timestamp = b.timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String message;
        private LogLevel level;
        private String service;
        private String errorCode;
        private Instant timestamp;

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public LogEntry build() {
            return new LogEntry(this);
        }
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message != null ? message : "";
    }

    public LogLevel getLevel() {
        return level;
    }

    public void setLevel(LogLevel level) {
        this.level = level != null ? level : LogLevel.INFO;
    }

    public String getService() {
        return service;
    }

    public void setService(String service) {
        this.service = service;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "LogEntry{" +
                "level=" + level +
                ", service='" + service + '\'' +
                ", errorCode='" + errorCode + '\'' +
                ", message='" + message + '\'' +
                '}';
    }
}
