package com.metricsentinel.core.evidence;

import com.metricsentinel.core.model.LogEntry;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scans log messages for well-known failure phrases.
 *
 * <p>
 * Each message is lower-cased and checked for every phrase in
 * {@link #VOCABULARY} by substring match. An explicit error code attached to
 * a log entry is reported verbatim. The result is deduplicated and keeps the
 * order of first occurrence.
 * </p>
 *
 * @since 1.0.0
 */
public final class LogPatternExtractor {

    /** Failure phrases, in reporting order within one message. */
    public static final List<String> VOCABULARY = List.of(
            "timeout", "deadline exceeded", "connection refused",
            "out of memory", "oom", "disk full", "no space left",
            "permission denied", "authentication failed",
            "rate limit", "throttled", "circuit breaker",
            "panic", "fatal", "crash", "killed");

    private LogPatternExtractor() {
        // utility class
    }

    /**
     * @param logs recent log entries, oldest first; {@code null} entries are ignored
     * @return distinct patterns and error codes in order of first occurrence
     */
    public static List<String> extract(List<LogEntry> logs) {
        if (logs == null || logs.isEmpty()) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        for (LogEntry log : logs) {
            if (log == null) {
                continue;
            }
            if (log.getMessage() != null) {
                String message = log.getMessage().toLowerCase(Locale.ROOT);
                for (String pattern : VOCABULARY) {
                    if (message.contains(pattern)) {
                        found.add(pattern);
                    }
                }
            }
            if (log.getErrorCode() != null && !log.getErrorCode().isBlank()) {
                found.add(log.getErrorCode());
            }
        }
        return List.copyOf(found);
    }
}
