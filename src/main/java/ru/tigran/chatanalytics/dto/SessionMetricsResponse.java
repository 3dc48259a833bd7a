package ru.tigran.chatanalytics.dto;

/**
 * KPI #1: Session Metrics.
 *
 * @param avgResponseTime average response time in seconds, rounded to 2 decimals
 */
public record SessionMetricsResponse(
        long totalSessions,
        long negativeFeedbackSessions,
        long positiveFeedbackSessions,
        double avgResponseTime,
        FiltersApplied filtersApplied
) {
}
