package ru.tigran.chatanalytics.dto;

import java.util.List;

/**
 * KPI #10: Conversation Length. Always three buckets: short (1-2), medium (3-5), long (6+).
 */
public record ConversationLengthResponse(
        long totalSessions,
        double avgMessagesPerSession,
        List<LengthBucket> distribution,
        long longestSessionMessages,
        FiltersApplied filtersApplied
) {

    public record LengthBucket(String category, long sessionCount, double percentage) {
    }
}
