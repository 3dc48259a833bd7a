package ru.tigran.chatanalytics.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.chatanalytics.dto.ConversationLengthResponse;
import ru.tigran.chatanalytics.dto.ConversationLengthResponse.LengthBucket;
import ru.tigran.chatanalytics.dto.FiltersApplied;
import ru.tigran.chatanalytics.dto.PlatformAnalyticsResponse;
import ru.tigran.chatanalytics.dto.PlatformAnalyticsResponse.InputTypeShare;
import ru.tigran.chatanalytics.dto.PlatformAnalyticsResponse.LanguageShare;
import ru.tigran.chatanalytics.dto.PlatformAnalyticsResponse.PlatformShare;
import ru.tigran.chatanalytics.dto.QueryCategoriesResponse;
import ru.tigran.chatanalytics.dto.QueryCategoriesResponse.CategoryShare;
import ru.tigran.chatanalytics.dto.ReturningUserBehaviorResponse;
import ru.tigran.chatanalytics.dto.SessionMetricsResponse;
import ru.tigran.chatanalytics.dto.TimePatternsResponse;
import ru.tigran.chatanalytics.dto.TimePatternsResponse.DayBucket;
import ru.tigran.chatanalytics.dto.TimePatternsResponse.HourBucket;
import ru.tigran.chatanalytics.dto.UserEngagementResponse;
import ru.tigran.chatanalytics.dto.UserRetentionResponse;
import ru.tigran.chatanalytics.dto.UserSegmentationResponse;
import ru.tigran.chatanalytics.dto.UserSegmentationResponse.Segment;
import ru.tigran.chatanalytics.dto.VolumeTrendsResponse;
import ru.tigran.chatanalytics.dto.VolumeTrendsResponse.DailyVolume;
import ru.tigran.chatanalytics.model.AnalyticsFilter;
import ru.tigran.chatanalytics.model.row.CategoryCountRow;
import ru.tigran.chatanalytics.model.row.DailyVolumeRow;
import ru.tigran.chatanalytics.model.row.EngagementRow;
import ru.tigran.chatanalytics.model.row.PlatformRow;
import ru.tigran.chatanalytics.model.row.ReturningUserRow;
import ru.tigran.chatanalytics.model.row.SessionLengthRow;
import ru.tigran.chatanalytics.model.row.SessionMetricsRow;
import ru.tigran.chatanalytics.model.row.TimeSlotRow;
import ru.tigran.chatanalytics.model.row.UserSessionCountRow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static ru.tigran.chatanalytics.util.StatsUtils.average;
import static ru.tigran.chatanalytics.util.StatsUtils.percentage;

/**
 * Pure transforms from KPI row sets to response shapes. No I/O.
 *
 * Shared policy:
 * - no rows gives the KPI's zero-valued shape, never an error
 * - percentages and averages are rounded to 2 decimals, 0.0 over an empty denominator
 * - peak / trough ties go to the first row in query order
 */
@Slf4j
@Component
public class KpiAggregator {

    static final String UNCATEGORIZED = "uncategorized";
    static final String UNKNOWN_LANGUAGE = "unknown";
    static final String[] DAY_NAMES = {
            "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
    };

    public SessionMetricsResponse sessionMetrics(AnalyticsFilter filter, Optional<SessionMetricsRow> row) {
        FiltersApplied applied = FiltersApplied.from(filter);
        if (row.isEmpty()) {
            return new SessionMetricsResponse(0, 0, 0, 0.0, applied);
        }
        SessionMetricsRow data = row.get();
        double avgResponseTime = data.avgResponseTime() == null ? 0.0 : average(data.avgResponseTime(), 1);
        return new SessionMetricsResponse(
                data.totalSessions(),
                data.negativeFeedbackSessions(),
                data.positiveFeedbackSessions(),
                avgResponseTime,
                applied
        );
    }

    public VolumeTrendsResponse volumeTrends(AnalyticsFilter filter, List<DailyVolumeRow> rows) {
        FiltersApplied applied = FiltersApplied.from(filter);
        if (rows.isEmpty()) {
            return new VolumeTrendsResponse(0.0, null, 0, null, 0, 0, 0, List.of(), applied);
        }

        long totalSessions = 0;
        DailyVolumeRow peak = rows.get(0);
        DailyVolumeRow lowest = rows.get(0);
        List<DailyVolume> daily = new ArrayList<>(rows.size());
        for (DailyVolumeRow row : rows) {
            totalSessions += row.sessionCount();
            // strict comparisons keep the earliest day on ties
            if (row.sessionCount() > peak.sessionCount()) {
                peak = row;
            }
            if (row.sessionCount() < lowest.sessionCount()) {
                lowest = row;
            }
            daily.add(new DailyVolume(isoDate(row), row.sessionCount()));
        }

        return new VolumeTrendsResponse(
                average(totalSessions, rows.size()),
                isoDate(peak),
                peak.sessionCount(),
                isoDate(lowest),
                lowest.sessionCount(),
                rows.size(),
                totalSessions,
                daily,
                applied
        );
    }

    public UserEngagementResponse userEngagement(AnalyticsFilter filter, Optional<EngagementRow> row) {
        FiltersApplied applied = FiltersApplied.from(filter);
        if (row.isEmpty()) {
            return new UserEngagementResponse(0, 0, 0.0, applied);
        }
        EngagementRow data = row.get();
        return new UserEngagementResponse(
                data.uniqueUsers(),
                data.totalConversations(),
                average(data.totalConversations(), data.uniqueUsers()),
                applied
        );
    }

    public UserRetentionResponse userRetention(AnalyticsFilter filter, List<UserSessionCountRow> rows) {
        long totalUsers = rows.size();
        long oneTimeUsers = rows.stream().filter(row -> row.sessionCount() == 1).count();
        long returningUsers = rows.stream().filter(row -> row.sessionCount() >= 2).count();

        return new UserRetentionResponse(
                totalUsers,
                returningUsers,
                oneTimeUsers,
                percentage(returningUsers, totalUsers),
                percentage(oneTimeUsers, totalUsers),
                FiltersApplied.from(filter)
        );
    }

    public QueryCategoriesResponse queryCategories(AnalyticsFilter filter, List<CategoryCountRow> rows) {
        // null and blank labels collapse into one bucket at the position of their first occurrence
        Map<String, Long> counts = new LinkedHashMap<>();
        for (CategoryCountRow row : rows) {
            String label = row.queryCategory() == null || row.queryCategory().isBlank()
                    ? UNCATEGORIZED
                    : row.queryCategory();
            counts.merge(label, row.sessionCount(), Long::sum);
        }

        long totalSessions = counts.values().stream().mapToLong(Long::longValue).sum();
        List<CategoryShare> categories = counts.entrySet().stream()
                .map(entry -> new CategoryShare(
                        entry.getKey(),
                        entry.getValue(),
                        percentage(entry.getValue(), totalSessions)
                ))
                .toList();

        return new QueryCategoriesResponse(totalSessions, categories, FiltersApplied.from(filter));
    }

    public ReturningUserBehaviorResponse returningUserBehavior(AnalyticsFilter filter, List<ReturningUserRow> rows) {
        FiltersApplied applied = FiltersApplied.from(filter);
        List<ReturningUserRow> returning = rows.stream()
                .filter(row -> row.sessionCount() >= 2)
                .toList();

        if (returning.isEmpty()) {
            return new ReturningUserBehaviorResponse(0, 0.0, null, 0, 0.0, 0, applied);
        }

        long totalSessions = 0;
        long totalActiveDays = 0;
        long longestSpan = 0;
        ReturningUserRow mostActive = returning.get(0);
        for (ReturningUserRow row : returning) {
            totalSessions += row.sessionCount();
            totalActiveDays += row.activeDays();
            longestSpan = Math.max(longestSpan, row.activeDays());
            if (row.sessionCount() > mostActive.sessionCount()) {
                mostActive = row;
            }
        }

        return new ReturningUserBehaviorResponse(
                returning.size(),
                average(totalSessions, returning.size()),
                mostActive.userId(),
                mostActive.sessionCount(),
                average(totalActiveDays, returning.size()),
                longestSpan,
                applied
        );
    }

    public UserSegmentationResponse userSegmentation(AnalyticsFilter filter, List<UserSessionCountRow> rows) {
        long totalUsers = rows.size();
        long low = rows.stream().filter(row -> row.sessionCount() == 1).count();
        long medium = rows.stream().filter(row -> row.sessionCount() >= 2 && row.sessionCount() <= 5).count();
        long high = rows.stream().filter(row -> row.sessionCount() >= 6).count();

        List<Segment> segments = List.of(
                new Segment("Low Activity (1 chat)", low, percentage(low, totalUsers)),
                new Segment("Medium Activity (2-5 chats)", medium, percentage(medium, totalUsers)),
                new Segment("High Activity (6+ chats)", high, percentage(high, totalUsers))
        );

        return new UserSegmentationResponse(totalUsers, segments, FiltersApplied.from(filter));
    }

    public TimePatternsResponse timePatterns(AnalyticsFilter filter, List<TimeSlotRow> rows) {
        long[] hourCounts = new long[24];
        long[] dayCounts = new long[7];
        for (TimeSlotRow row : rows) {
            if (row.hourOfDay() < 0 || row.hourOfDay() > 23 || row.dayOfWeek() < 0 || row.dayOfWeek() > 6) {
                log.warn("Skipping time slot outside histogram range: hour={}, day={}", row.hourOfDay(), row.dayOfWeek());
                continue;
            }
            hourCounts[row.hourOfDay()] += row.sessionCount();
            dayCounts[row.dayOfWeek()] += row.sessionCount();
        }

        List<HourBucket> byHour = new ArrayList<>(24);
        int peakHour = 0;
        for (int hour = 0; hour < 24; hour++) {
            byHour.add(new HourBucket(hour, hourCounts[hour]));
            if (hourCounts[hour] > hourCounts[peakHour]) {
                peakHour = hour;
            }
        }

        List<DayBucket> byDay = new ArrayList<>(7);
        int peakDay = 0;
        for (int day = 0; day < 7; day++) {
            byDay.add(new DayBucket(DAY_NAMES[day], day, dayCounts[day]));
            if (dayCounts[day] > dayCounts[peakDay]) {
                peakDay = day;
            }
        }

        boolean hasData = !rows.isEmpty();
        return new TimePatternsResponse(
                byHour,
                byDay,
                hasData ? peakHour : null,
                hourCounts[peakHour],
                hasData ? DAY_NAMES[peakDay] : null,
                dayCounts[peakDay],
                FiltersApplied.from(filter)
        );
    }

    public ConversationLengthResponse conversationLength(AnalyticsFilter filter, List<SessionLengthRow> rows) {
        long totalSessions = rows.size();
        long totalMessages = 0;
        long longest = 0;
        long shortCount = 0;
        long mediumCount = 0;
        long longCount = 0;
        for (SessionLengthRow row : rows) {
            long messages = row.messageCount();
            totalMessages += messages;
            longest = Math.max(longest, messages);
            if (messages <= 2) {
                shortCount++;
            } else if (messages <= 5) {
                mediumCount++;
            } else {
                longCount++;
            }
        }

        List<LengthBucket> distribution = List.of(
                new LengthBucket("Short (1-2 messages)", shortCount, percentage(shortCount, totalSessions)),
                new LengthBucket("Medium (3-5 messages)", mediumCount, percentage(mediumCount, totalSessions)),
                new LengthBucket("Long (6+ messages)", longCount, percentage(longCount, totalSessions))
        );

        return new ConversationLengthResponse(
                totalSessions,
                average(totalMessages, totalSessions),
                distribution,
                longest,
                FiltersApplied.from(filter)
        );
    }

    public PlatformAnalyticsResponse platformAnalytics(AnalyticsFilter filter, List<PlatformRow> rows) {
        Map<String, long[]> languages = new LinkedHashMap<>();
        long textSessions = 0;
        long voiceSessions = 0;
        long webSessions = 0;
        long mobileSessions = 0;

        for (PlatformRow row : rows) {
            String language = row.chatLanguage() == null || row.chatLanguage().isBlank()
                    ? UNKNOWN_LANGUAGE
                    : row.chatLanguage();
            long[] totals = languages.computeIfAbsent(language, key -> new long[2]);
            totals[0] += row.sessionCount();
            totals[1] += row.userCount();

            if (row.voiceInput()) {
                voiceSessions += row.sessionCount();
            } else {
                textSessions += row.sessionCount();
            }

            if (row.mobileApp()) {
                mobileSessions += row.sessionCount();
            } else {
                webSessions += row.sessionCount();
            }
        }

        long languageTotal = languages.values().stream().mapToLong(totals -> totals[0]).sum();
        // List.sort is stable, so equal session counts keep first-seen order
        List<LanguageShare> byLanguage = new ArrayList<>();
        languages.forEach((language, totals) -> byLanguage.add(
                new LanguageShare(language, totals[0], totals[1], percentage(totals[0], languageTotal))));
        byLanguage.sort(Comparator.comparingLong(LanguageShare::sessionCount).reversed());

        long inputTotal = textSessions + voiceSessions;
        List<InputTypeShare> byVoice = List.of(
                new InputTypeShare("Text", textSessions, percentage(textSessions, inputTotal)),
                new InputTypeShare("Voice", voiceSessions, percentage(voiceSessions, inputTotal))
        );

        long platformTotal = webSessions + mobileSessions;
        List<PlatformShare> byMobile = List.of(
                new PlatformShare("Web", webSessions, percentage(webSessions, platformTotal)),
                new PlatformShare("Mobile", mobileSessions, percentage(mobileSessions, platformTotal))
        );

        return new PlatformAnalyticsResponse(byLanguage, byVoice, byMobile, FiltersApplied.from(filter));
    }

    private static String isoDate(DailyVolumeRow row) {
        return row.date() == null ? null : row.date().toString();
    }
}
