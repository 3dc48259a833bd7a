package ru.tigran.chatanalytics.model;

import ru.tigran.chatanalytics.exception.ErrorCode;
import ru.tigran.chatanalytics.exception.ValidationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;

/**
 * Canonical filter for every analytics query.
 *
 * Applied at SQL level, never post-filtered in memory. The date range is inclusive on both ends.
 * Blank environment and userId are normalized to null (not populated).
 *
 * @param startDate range start (inclusive)
 * @param endDate range end (inclusive)
 * @param productContext dataset selector
 * @param environment optional exact-match environment
 * @param userId optional exact-match user id
 * @param userType membership scope, never null (defaults to ALL)
 */
public record AnalyticsFilter(
        LocalDateTime startDate,
        LocalDateTime endDate,
        ProductContext productContext,
        String environment,
        String userId,
        UserType userType
) {

    public AnalyticsFilter {
        Objects.requireNonNull(startDate, "startDate");
        Objects.requireNonNull(endDate, "endDate");
        Objects.requireNonNull(productContext, "productContext");
        environment = blankToNull(environment);
        userId = blankToNull(userId);
        userType = userType == null ? UserType.ALL : userType;

        if (startDate.isAfter(endDate)) {
            throw new ValidationException(
                    "start_date (" + startDate + ") must not be after end_date (" + endDate + ")",
                    ErrorCode.INVALID_DATE_RANGE.getCode()
            );
        }
    }

    /**
     * Builds a filter from raw request tokens, rejecting anything out of domain.
     *
     * @param startDate ISO 8601 date or date-time
     * @param endDate ISO 8601 date or date-time
     * @param productContext "pool" or "landscape"
     * @param environment optional environment
     * @param userId optional user id
     * @param userType "all", "internal", "external" or null
     * @return validated filter
     * @throws ValidationException for any malformed value
     */
    public static AnalyticsFilter of(
            String startDate,
            String endDate,
            String productContext,
            String environment,
            String userId,
            String userType
    ) {
        LocalDateTime start = parseTimestamp("start_date", startDate);
        LocalDateTime end = parseTimestamp("end_date", endDate);

        ProductContext context;
        try {
            context = ProductContext.fromValue(productContext);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(
                    e.getMessage() + " (expected 'pool' or 'landscape')",
                    ErrorCode.INVALID_PRODUCT_CONTEXT.getCode()
            );
        }

        UserType type;
        try {
            type = UserType.fromValue(userType);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(
                    e.getMessage() + " (expected 'all', 'internal' or 'external')",
                    ErrorCode.INVALID_USER_TYPE.getCode()
            );
        }

        return new AnalyticsFilter(start, end, context, environment, userId, type);
    }

    /**
     * Accepts an offset date-time (converted to UTC), a local date-time or a plain date (start of day).
     * A space is accepted in place of the 'T' separator.
     */
    static LocalDateTime parseTimestamp(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + ": parameter is required", ErrorCode.INVALID_DATE.getCode());
        }
        String normalized = value.trim();
        if (normalized.length() > 10 && normalized.charAt(10) == ' ') {
            normalized = normalized.substring(0, 10) + "T" + normalized.substring(11);
        }
        try {
            if (normalized.indexOf('T') < 0) {
                return LocalDate.parse(normalized).atStartOfDay();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(normalized, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime) {
                return ((OffsetDateTime) parsed).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
            return (LocalDateTime) parsed;
        } catch (DateTimeParseException e) {
            throw new ValidationException(
                    field + ": '" + value + "' is not a valid ISO 8601 date or date-time",
                    ErrorCode.INVALID_DATE.getCode()
            );
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
