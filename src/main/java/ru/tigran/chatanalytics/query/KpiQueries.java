package ru.tigran.chatanalytics.query;

import org.springframework.stereotype.Component;
import ru.tigran.chatanalytics.model.AnalyticsFilter;

/**
 * Query templates for each KPI.
 *
 * Each template pins an explicit ORDER BY so that tie-breaks in the aggregators
 * (first row wins) are reproducible between runs.
 */
@Component
public class KpiQueries {

    private final AnalyticsQueryBuilder builder;

    public KpiQueries(AnalyticsQueryBuilder builder) {
        this.builder = builder;
    }

    /** KPI #1: distinct sessions, sessions with negative / positive feedback, average latency. */
    public SqlQuery sessionMetrics(AnalyticsFilter filter) {
        return builder.build(filter, QuerySpec.select(
                "COUNT(DISTINCT session_id) AS total_sessions, "
                        + "COUNT(DISTINCT CASE WHEN user_feedback = '-1' THEN session_id END) AS negative_feedback_sessions, "
                        + "COUNT(DISTINCT CASE WHEN user_feedback = '1' THEN session_id END) AS positive_feedback_sessions, "
                        + "AVG(response_time) AS avg_response_time"));
    }

    /** KPI #2 and #12: every non-empty user input, oldest first. */
    public SqlQuery userQueries(AnalyticsFilter filter) {
        return builder.build(filter, QuerySpec.select("id, session_id, input AS user_query")
                .where("input IS NOT NULL AND input <> ''")
                .orderBy("time_stamp, id"));
    }

    /** KPI #3: distinct sessions per calendar day. */
    public SqlQuery volumeTrends(AnalyticsFilter filter) {
        return builder.build(filter, QuerySpec.select(
                        "DATE(time_stamp) AS activity_date, COUNT(DISTINCT session_id) AS session_count")
                .groupBy("DATE(time_stamp)")
                .orderBy("activity_date"));
    }

    /** KPI #4: unique users and conversations. */
    public SqlQuery userEngagement(AnalyticsFilter filter) {
        return builder.build(filter, QuerySpec.select(
                "COUNT(DISTINCT user_id) AS unique_users, COUNT(DISTINCT session_id) AS total_conversations"));
    }

    /** KPI #5 and #8: distinct sessions per user. */
    public SqlQuery userSessionCounts(AnalyticsFilter filter) {
        return builder.build(filter, QuerySpec.select("user_id, COUNT(DISTINCT session_id) AS session_count")
                .groupBy("user_id")
                .orderBy("user_id"));
    }

    /** KPI #6: distinct sessions per query category, largest first. */
    public SqlQuery queryCategories(AnalyticsFilter filter) {
        return builder.build(filter, QuerySpec.select("query_category, COUNT(DISTINCT session_id) AS session_count")
                .groupBy("query_category")
                .orderBy("session_count DESC, query_category"));
    }

    /** KPI #7: per-user session count and first / last activity date. */
    public SqlQuery returningUserBehavior(AnalyticsFilter filter) {
        return builder.build(filter, QuerySpec.select(
                        "user_id, COUNT(DISTINCT session_id) AS session_count, "
                                + "MIN(DATE(time_stamp)) AS first_chat_date, "
                                + "MAX(DATE(time_stamp)) AS last_chat_date")
                .where("user_id IS NOT NULL")
                .groupBy("user_id")
                .orderBy("user_id"));
    }

    /** KPI #9: distinct sessions per (hour of day, day of week). */
    public SqlQuery timePatterns(AnalyticsFilter filter) {
        return builder.build(filter, QuerySpec.select(
                        "EXTRACT(HOUR FROM time_stamp) AS hour_of_day, "
                                + "EXTRACT(DOW FROM time_stamp) AS day_of_week, "
                                + "COUNT(DISTINCT session_id) AS session_count")
                .groupBy("EXTRACT(HOUR FROM time_stamp), EXTRACT(DOW FROM time_stamp)")
                .orderBy("hour_of_day, day_of_week"));
    }

    /** KPI #10: messages per session. */
    public SqlQuery conversationLength(AnalyticsFilter filter) {
        return builder.build(filter, QuerySpec.select("session_id, COUNT(*) AS message_count")
                .groupBy("session_id")
                .orderBy("session_id"));
    }

    /** KPI #11: sessions and users per (language, voice input, mobile app) combination. */
    public SqlQuery platformAnalytics(AnalyticsFilter filter) {
        return builder.build(filter, QuerySpec.select(
                        "chat_language, is_voice_input, is_mobile_app, "
                                + "COUNT(DISTINCT session_id) AS session_count, "
                                + "COUNT(DISTINCT user_id) AS user_count")
                .groupBy("chat_language, is_voice_input, is_mobile_app")
                .orderBy("chat_language, is_voice_input, is_mobile_app"));
    }
}
