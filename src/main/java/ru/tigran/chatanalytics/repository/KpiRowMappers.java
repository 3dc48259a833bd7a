package ru.tigran.chatanalytics.repository;

import org.springframework.jdbc.core.RowMapper;
import ru.tigran.chatanalytics.model.row.CategoryCountRow;
import ru.tigran.chatanalytics.model.row.DailyVolumeRow;
import ru.tigran.chatanalytics.model.row.EngagementRow;
import ru.tigran.chatanalytics.model.row.PlatformRow;
import ru.tigran.chatanalytics.model.row.ReturningUserRow;
import ru.tigran.chatanalytics.model.row.SessionLengthRow;
import ru.tigran.chatanalytics.model.row.SessionMetricsRow;
import ru.tigran.chatanalytics.model.row.TimeSlotRow;
import ru.tigran.chatanalytics.model.row.UserQueryRow;
import ru.tigran.chatanalytics.model.row.UserSessionCountRow;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

/**
 * Row mappers binding the column aliases of {@code KpiQueries} to typed row records.
 */
public final class KpiRowMappers {

    public static final RowMapper<SessionMetricsRow> SESSION_METRICS = (rs, rowNum) -> new SessionMetricsRow(
            rs.getLong("total_sessions"),
            rs.getLong("negative_feedback_sessions"),
            rs.getLong("positive_feedback_sessions"),
            nullableDouble(rs, "avg_response_time")
    );

    public static final RowMapper<UserQueryRow> USER_QUERY = (rs, rowNum) -> new UserQueryRow(
            rs.getString("id"),
            rs.getString("session_id"),
            rs.getString("user_query")
    );

    public static final RowMapper<DailyVolumeRow> DAILY_VOLUME = (rs, rowNum) -> new DailyVolumeRow(
            localDate(rs, "activity_date"),
            rs.getLong("session_count")
    );

    public static final RowMapper<EngagementRow> ENGAGEMENT = (rs, rowNum) -> new EngagementRow(
            rs.getLong("unique_users"),
            rs.getLong("total_conversations")
    );

    public static final RowMapper<UserSessionCountRow> USER_SESSION_COUNT = (rs, rowNum) -> new UserSessionCountRow(
            rs.getString("user_id"),
            rs.getLong("session_count")
    );

    public static final RowMapper<CategoryCountRow> CATEGORY_COUNT = (rs, rowNum) -> new CategoryCountRow(
            rs.getString("query_category"),
            rs.getLong("session_count")
    );

    public static final RowMapper<ReturningUserRow> RETURNING_USER = (rs, rowNum) -> new ReturningUserRow(
            rs.getString("user_id"),
            rs.getLong("session_count"),
            localDate(rs, "first_chat_date"),
            localDate(rs, "last_chat_date")
    );

    public static final RowMapper<TimeSlotRow> TIME_SLOT = (rs, rowNum) -> new TimeSlotRow(
            rs.getInt("hour_of_day"),
            rs.getInt("day_of_week"),
            rs.getLong("session_count")
    );

    public static final RowMapper<SessionLengthRow> SESSION_LENGTH = (rs, rowNum) -> new SessionLengthRow(
            rs.getString("session_id"),
            rs.getLong("message_count")
    );

    public static final RowMapper<PlatformRow> PLATFORM = (rs, rowNum) -> new PlatformRow(
            rs.getString("chat_language"),
            rs.getBoolean("is_voice_input"),
            rs.getBoolean("is_mobile_app"),
            rs.getLong("session_count"),
            rs.getLong("user_count")
    );

    private KpiRowMappers() {
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).doubleValue();
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.valueOf(value.toString());
    }

    private static LocalDate localDate(ResultSet rs, String column) throws SQLException {
        Date date = rs.getDate(column);
        return date == null ? null : date.toLocalDate();
    }
}
