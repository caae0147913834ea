package com.metricsentinel.core.rca;

import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.Event;
import com.metricsentinel.core.model.LogEntry;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds the advisory-analysis prompt sent to the {@link LlmClient}.
 *
 * @since 1.0.0
 */
public final class RcaPromptBuilder {

    /** Maximum number of log lines and of events included in a prompt. */
    static final int MAX_ITEMS = 10;

    /** Log messages and event messages are truncated to this many characters. */
    static final int MAX_MESSAGE_CHARS = 100;

    private RcaPromptBuilder() {
        // utility class
    }

    public static String build(Anomaly anomaly, List<String> hypotheses, List<LogEntry> logs, List<Event> events) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");

        String hypothesisBlock = hypotheses == null || hypotheses.isEmpty()
                ? "- No strong hypotheses yet"
                : hypotheses.stream().map(h -> "- " + h).collect(Collectors.joining("\n"));

        String logBlock = logs == null ? "" : logs.stream()
                .filter(Objects::nonNull)
                .limit(MAX_ITEMS)
                .map(log -> String.format(Locale.ROOT, "- [%s] %s: %s",
                        log.getLevel().name().toLowerCase(Locale.ROOT), log.getService(),
                        truncate(log.getMessage())))
                .collect(Collectors.joining("\n"));

        String eventBlock = events == null ? "" : events.stream()
                .filter(Objects::nonNull)
                .limit(MAX_ITEMS)
                .map(e -> String.format(Locale.ROOT, "- %s - %s", e.summary(), truncate(e.getMessage())))
                .collect(Collectors.joining("\n"));

        return String.format(Locale.ROOT,
                "Analyze this system anomaly and provide root cause insights.\n\n"
                        + "ANOMALY:\n"
                        + "- Metric: %s\n"
                        + "- Category: %s\n"
                        + "- Current Value: %.4f\n"
                        + "- Baseline Value: %.4f\n"
                        + "- Deviation: %.2f sigma (%+.1f%%)\n"
                        + "- Duration: %d minutes\n\n"
                        + "CURRENT HYPOTHESES:\n%s\n\n"
                        + "RECENT LOGS:\n%s\n\n"
                        + "RECENT EVENTS:\n%s\n\n"
                        + "Based on this information:\n"
                        + "1. What is the most likely root cause?\n"
                        + "2. What additional evidence should we look for?\n"
                        + "3. What immediate action should be taken?\n\n"
                        + "Keep response concise (max 200 words).",
                anomaly.getMetricName(),
                anomaly.getCategory().label(),
                anomaly.getCurrentValue(),
                anomaly.getBaselineValue(),
                anomaly.getDeviation(),
                anomaly.getDeviationPercent(),
                anomaly.getDurationMinutes(),
                hypothesisBlock,
                logBlock.isEmpty() ? "No relevant logs" : logBlock,
                eventBlock.isEmpty() ? "No recent events" : eventBlock);
    }

    private static String truncate(String message) {
        if (message == null) {
            return "";
        }
        return message.length() <= MAX_MESSAGE_CHARS ? message : message.substring(0, MAX_MESSAGE_CHARS);
    }
}
