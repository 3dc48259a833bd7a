package ru.tigran.chatanalytics.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameterized SQL ready for execution.
 * Filter values only ever travel in {@code parameters}, bound by name ({@code :start_date}).
 *
 * @param sql query text with named placeholders
 * @param parameters placeholder name to bound value, in insertion order
 */
public record SqlQuery(String sql, Map<String, Object> parameters) {

    public SqlQuery {
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
