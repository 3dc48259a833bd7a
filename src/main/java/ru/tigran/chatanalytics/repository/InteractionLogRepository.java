package ru.tigran.chatanalytics.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import ru.tigran.chatanalytics.exception.ErrorCode;
import ru.tigran.chatanalytics.exception.QueryExecutionException;
import ru.tigran.chatanalytics.query.SqlQuery;

import java.util.List;
import java.util.Optional;

/**
 * Read-only executor for analytics queries against the interaction logs.
 *
 * Connections come from the injected pooled DataSource; NamedParameterJdbcTemplate acquires one
 * per call and releases it on every exit path, including failures. Rows are returned in the
 * order the query states, and no match yields an empty list rather than an error.
 */
@Slf4j
@Repository
public class InteractionLogRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public InteractionLogRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Executes the query and maps every row.
     *
     * @throws QueryExecutionException if the store rejects or fails the query
     */
    public <T> List<T> fetchAll(SqlQuery query, RowMapper<T> rowMapper) {
        try {
            List<T> rows = jdbcTemplate.query(query.sql(), new MapSqlParameterSource(query.parameters()), rowMapper);
            log.debug("Query returned {} rows", rows.size());
            return rows;
        } catch (DataAccessException e) {
            log.error("Query execution failed: {}", e.getMessage(), e);
            throw new QueryExecutionException(
                    "Analytics query failed: " + e.getMostSpecificCause().getMessage(),
                    ErrorCode.QUERY_EXECUTION_FAILED.getCode(),
                    e
            );
        }
    }

    /**
     * Executes the query and maps only its first row.
     *
     * @return first row, or empty if the query matched nothing
     * @throws QueryExecutionException if the store rejects or fails the query
     */
    public <T> Optional<T> fetchOne(SqlQuery query, RowMapper<T> rowMapper) {
        return fetchAll(query, rowMapper).stream().findFirst();
    }

    /**
     * Server version string, used by the datasets health indicator.
     */
    public String serverVersion() {
        return jdbcTemplate.getJdbcTemplate().queryForObject("SELECT version()", String.class);
    }

    /**
     * Total row count of a table, used by the datasets health indicator.
     * The table name must already be a validated identifier.
     */
    public long countRows(String table) {
        Long count = jdbcTemplate.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0 : count;
    }
}
