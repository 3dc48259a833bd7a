package ru.tigran.chatanalytics.exception;

/**
 * Thrown when deployment configuration cannot serve a request,
 * e.g. no physical table is configured for a product context.
 * HTTP status: 500 Internal Server Error
 */
public class ConfigurationException extends ApplicationException {
    public ConfigurationException(String message, String errorCode) {
        super(message, errorCode);
    }
}
