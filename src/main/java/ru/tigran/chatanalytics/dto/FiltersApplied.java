package ru.tigran.chatanalytics.dto;

import ru.tigran.chatanalytics.model.AnalyticsFilter;

import java.time.format.DateTimeFormatter;

/**
 * Echo of the filter a KPI was computed with, so callers can correlate responses to requests.
 */
public record FiltersApplied(
        String startDate,
        String endDate,
        String productContext,
        String environment,
        String userId,
        String userType
) {

    public static FiltersApplied from(AnalyticsFilter filter) {
        return new FiltersApplied(
                filter.startDate().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                filter.endDate().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
                filter.productContext().getValue(),
                filter.environment(),
                filter.userId(),
                filter.userType().getValue()
        );
    }
}
