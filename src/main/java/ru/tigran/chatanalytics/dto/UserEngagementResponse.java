package ru.tigran.chatanalytics.dto;

/**
 * KPI #4: User Engagement.
 */
public record UserEngagementResponse(
        long uniqueUsers,
        long totalConversations,
        double avgConversationsPerUser,
        FiltersApplied filtersApplied
) {
}
