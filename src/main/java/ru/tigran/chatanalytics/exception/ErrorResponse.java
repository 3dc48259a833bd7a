package ru.tigran.chatanalytics.exception;

/**
 * Error body returned for every failed request.
 *
 * @param code machine-readable error code (see {@link ErrorCode})
 * @param message human-readable description
 */
public record ErrorResponse(String code, String message) {
}
