package ru.tigran.chatanalytics.dto;

import java.util.List;

/**
 * KPI #3: Volume Trends.
 *
 * Example:
 * {
 *   "avg_sessions_per_day": 12.5,
 *   "peak_day": "2024-01-03", "peak_day_sessions": 20,
 *   "lowest_day": "2024-01-01", "lowest_day_sessions": 5,
 *   "daily_data": [{"date": "2024-01-01", "session_count": 5}, ...]
 * }
 *
 * @param peakDay ISO date of the busiest day, null when there is no data
 * @param lowestDay ISO date of the quietest day, null when there is no data
 */
public record VolumeTrendsResponse(
        double avgSessionsPerDay,
        String peakDay,
        long peakDaySessions,
        String lowestDay,
        long lowestDaySessions,
        long totalDays,
        long totalSessions,
        List<DailyVolume> dailyData,
        FiltersApplied filtersApplied
) {

    public record DailyVolume(String date, long sessionCount) {
    }
}
