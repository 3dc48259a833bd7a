package ru.tigran.chatanalytics.query;

/**
 * KPI-specific parts of a query. Every clause is given without its keyword;
 * null means the clause is absent.
 *
 * @param select projection list
 * @param additionalWhere extra predicate, ANDed after the filter predicates
 * @param groupBy grouping list
 * @param orderBy ordering list
 */
public record QuerySpec(String select, String additionalWhere, String groupBy, String orderBy) {

    public static QuerySpec select(String select) {
        return new QuerySpec(select, null, null, null);
    }

    public QuerySpec where(String predicate) {
        return new QuerySpec(select, predicate, groupBy, orderBy);
    }

    public QuerySpec groupBy(String columns) {
        return new QuerySpec(select, additionalWhere, columns, orderBy);
    }

    public QuerySpec orderBy(String columns) {
        return new QuerySpec(select, additionalWhere, groupBy, columns);
    }
}
