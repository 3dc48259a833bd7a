package ru.tigran.chatanalytics.exception;

/**
 * Thrown when the external text classifier (chat completions API) fails.
 * Wraps HTTP errors, open circuit breaker rejections and response parsing failures.
 *
 * KPI computations never surface this exception: the clustering pipeline converts it
 * into the category-0 fallback for the affected query.
 * Retriable for 429, 502, 503, 504; non-retriable otherwise.
 */
public class AIGatewayException extends ApplicationException {
    public AIGatewayException(String message, String errorCode) {
        super(message, errorCode);
    }

    public AIGatewayException(String message, String errorCode, boolean retriable) {
        super(message, errorCode, retriable);
    }

    public AIGatewayException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, false, cause);
    }

    public AIGatewayException(String message, String errorCode, boolean retriable, Throwable cause) {
        super(message, errorCode, retriable, cause);
    }
}
