package ru.tigran.chatanalytics.exception;

/**
 * Thrown for malformed or out-of-domain filter values.
 * Examples: unknown product_context, unparseable date, start_date after end_date.
 * HTTP status: 400 Bad Request
 */
public class ValidationException extends ApplicationException {
    public ValidationException(String message, String errorCode) {
        super(message, errorCode);
    }
}
