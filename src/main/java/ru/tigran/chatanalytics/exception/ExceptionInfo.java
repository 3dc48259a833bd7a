package ru.tigran.chatanalytics.exception;

import org.springframework.http.HttpStatus;

/**
 * Internal class used by GlobalExceptionHandler to map exception types to HTTP status codes,
 * logging levels and whether the exception message may be shown to the caller.
 */
record ExceptionInfo(HttpStatus status, boolean shouldLogError, boolean exposeMessage) {
    /**
     * Returns ExceptionInfo for given ApplicationException type.
     *
     * @param exception ApplicationException instance
     * @return ExceptionInfo with status and logging configuration
     */
    static ExceptionInfo forException(ApplicationException exception) {
        if (exception instanceof ValidationException) {
            return new ExceptionInfo(HttpStatus.BAD_REQUEST, false, true);
        } else if (exception instanceof QueryExecutionException) {
            return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true, false);
        } else if (exception instanceof ConfigurationException) {
            return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true, false);
        } else if (exception instanceof AIGatewayException) {
            return new ExceptionInfo(HttpStatus.BAD_GATEWAY, true, false);
        }
        // Default for unknown ApplicationException subtypes
        return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true, false);
    }
}
