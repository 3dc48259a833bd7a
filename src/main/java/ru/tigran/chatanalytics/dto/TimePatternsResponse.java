package ru.tigran.chatanalytics.dto;

import java.util.List;

/**
 * KPI #9: Time Patterns. byHour always has 24 entries, byDay always 7 (0 = Sunday).
 *
 * @param peakHour null when there is no data
 * @param peakDay day name, null when there is no data
 */
public record TimePatternsResponse(
        List<HourBucket> byHour,
        List<DayBucket> byDay,
        Integer peakHour,
        long peakHourSessions,
        String peakDay,
        long peakDaySessions,
        FiltersApplied filtersApplied
) {

    public record HourBucket(int hour, long sessionCount) {
    }

    public record DayBucket(String day, int dayNumber, long sessionCount) {
    }
}
