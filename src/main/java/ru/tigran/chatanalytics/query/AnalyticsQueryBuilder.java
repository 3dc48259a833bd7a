package ru.tigran.chatanalytics.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.chatanalytics.model.AnalyticsFilter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates an {@link AnalyticsFilter} plus a KPI {@link QuerySpec} into parameterized SQL.
 *
 * Every query gets the inclusive date-range predicate. Environment, user id and user type
 * predicates are appended only when populated. All predicates, including the KPI's own,
 * are joined with AND. Grouping and ordering are appended verbatim.
 */
@Slf4j
@Component
public class AnalyticsQueryBuilder {

    static final String START_DATE = "start_date";
    static final String END_DATE = "end_date";
    static final String ENVIRONMENT = "environment";
    static final String USER_ID = "user_id";

    private final DatasetResolver datasetResolver;

    public AnalyticsQueryBuilder(DatasetResolver datasetResolver) {
        this.datasetResolver = datasetResolver;
    }

    public SqlQuery build(AnalyticsFilter filter, QuerySpec spec) {
        String table = datasetResolver.tableFor(filter.productContext());

        List<String> conditions = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();
        appendFilterPredicates(filter, conditions, params);

        if (spec.additionalWhere() != null && !spec.additionalWhere().isBlank()) {
            conditions.add("(" + spec.additionalWhere() + ")");
        }

        StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(spec.select())
                .append(" FROM ").append(table)
                .append(" WHERE ").append(String.join(" AND ", conditions));

        if (spec.groupBy() != null) {
            sql.append(" GROUP BY ").append(spec.groupBy());
        }
        if (spec.orderBy() != null) {
            sql.append(" ORDER BY ").append(spec.orderBy());
        }

        SqlQuery query = new SqlQuery(sql.toString(), params);
        log.debug("Built query: {} | params: {}", query.sql(), query.parameters().keySet());
        return query;
    }

    private void appendFilterPredicates(AnalyticsFilter filter, List<String> conditions, Map<String, Object> params) {
        conditions.add("time_stamp >= :" + START_DATE);
        conditions.add("time_stamp <= :" + END_DATE);
        params.put(START_DATE, filter.startDate());
        params.put(END_DATE, filter.endDate());

        if (filter.environment() != null) {
            conditions.add("environment = :" + ENVIRONMENT);
            params.put(ENVIRONMENT, filter.environment());
        }

        if (filter.userId() != null) {
            conditions.add("user_id = :" + USER_ID);
            params.put(USER_ID, filter.userId());
        }

        String internalUsers = datasetResolver.internalUsersTable();
        switch (filter.userType()) {
            case INTERNAL -> conditions.add(
                    "user_id IN (SELECT user_id FROM " + internalUsers + ")");
            case EXTERNAL -> conditions.add(
                    "user_id NOT IN (SELECT user_id FROM " + internalUsers + " WHERE user_id IS NOT NULL)");
            case ALL -> {
                // no membership predicate
            }
        }
    }
}
