package ru.tigran.chatanalytics.exception;

/**
 * Base exception class for all application-specific exceptions.
 * Carries an error code for the response body and a retriability flag.
 *
 * Retriable exceptions indicate transient errors (e.g., 429, 502, 503, 504 from an upstream service).
 * The analytics engine itself never retries; the flag is informational for callers and logs.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;
    private final boolean retriable;

    public ApplicationException(String message, String errorCode) {
        this(message, errorCode, false);
    }

    public ApplicationException(String message, String errorCode, boolean retriable) {
        super(message);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    public ApplicationException(String message, String errorCode, Throwable cause) {
        this(message, errorCode, false, cause);
    }

    public ApplicationException(String message, String errorCode, boolean retriable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Returns true if this exception represents a transient error.
     *
     * @return true if retriable, false if permanent error
     */
    public boolean isRetriable() {
        return retriable;
    }
}
