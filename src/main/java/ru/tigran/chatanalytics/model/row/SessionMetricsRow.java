package ru.tigran.chatanalytics.model.row;

/**
 * Single aggregate row for session metrics.
 *
 * @param avgResponseTime average response latency in seconds, null when no rows matched
 */
public record SessionMetricsRow(
        long totalSessions,
        long negativeFeedbackSessions,
        long positiveFeedbackSessions,
        Double avgResponseTime
) {
}
