package ru.tigran.chatanalytics.dto;

/**
 * KPI #7: Returning-User Behavior, computed over users with two or more sessions.
 *
 * @param mostActiveUserId null when there are no returning users
 */
public record ReturningUserBehaviorResponse(
        long returningUsersCount,
        double avgSessionsPerReturningUser,
        String mostActiveUserId,
        long mostActiveUserSessions,
        double avgDaysBetweenFirstLast,
        long longestActiveUserSpanDays,
        FiltersApplied filtersApplied
) {
}
