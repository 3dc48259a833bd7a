package ru.tigran.chatanalytics.dto;

import java.util.List;

/**
 * KPI #6: Query Categories.
 */
public record QueryCategoriesResponse(
        long totalSessions,
        List<CategoryShare> categories,
        FiltersApplied filtersApplied
) {

    public record CategoryShare(String category, long sessionCount, double percentage) {
    }
}
