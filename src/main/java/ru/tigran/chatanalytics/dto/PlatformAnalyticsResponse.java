package ru.tigran.chatanalytics.dto;

import java.util.List;

/**
 * KPI #11: Platform Analytics. Each breakdown's percentages use that breakdown's own total.
 */
public record PlatformAnalyticsResponse(
        List<LanguageShare> byLanguage,
        List<InputTypeShare> byVoice,
        List<PlatformShare> byMobile,
        FiltersApplied filtersApplied
) {

    public record LanguageShare(String language, long sessionCount, long userCount, double percentage) {
    }

    public record InputTypeShare(String inputType, long sessionCount, double percentage) {
    }

    public record PlatformShare(String platform, long sessionCount, double percentage) {
    }
}
