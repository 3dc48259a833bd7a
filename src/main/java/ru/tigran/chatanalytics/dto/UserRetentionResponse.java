package ru.tigran.chatanalytics.dto;

/**
 * KPI #5: User Retention. One-time users have exactly one session, returning users two or more.
 */
public record UserRetentionResponse(
        long totalUsers,
        long returningUsers,
        long oneTimeUsers,
        double returningUsersPercentage,
        double oneTimeUsersPercentage,
        FiltersApplied filtersApplied
) {
}
