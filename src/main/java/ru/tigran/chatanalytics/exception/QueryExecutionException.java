package ru.tigran.chatanalytics.exception;

/**
 * Thrown when the relational store fails to execute an analytics query.
 * Not recovered locally: a KPI without its rows has no meaningful partial result.
 * HTTP status: 500 Internal Server Error (generic message)
 */
public class QueryExecutionException extends ApplicationException {
    public QueryExecutionException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }
}
