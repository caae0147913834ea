package com.metricsentinel.core.model;

/**
 * Severity level of a log line.
 *
 * @since 1.0.0
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL
}
