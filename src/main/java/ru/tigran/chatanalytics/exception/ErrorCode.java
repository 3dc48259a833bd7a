package ru.tigran.chatanalytics.exception;

/**
 * Enum for application error codes.
 * Centralizes all error code definitions to avoid magic strings.
 * Each code has a default message for logging purposes.
 */
public enum ErrorCode {
    // Validation errors
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),
    INVALID_PRODUCT_CONTEXT("INVALID_PRODUCT_CONTEXT", "Unknown product context"),
    INVALID_USER_TYPE("INVALID_USER_TYPE", "Unknown user type"),
    INVALID_DATE("INVALID_DATE", "Date is not a valid ISO 8601 value"),
    INVALID_DATE_RANGE("INVALID_DATE_RANGE", "start_date must not be after end_date"),

    // Configuration errors
    DATASET_NOT_CONFIGURED("DATASET_NOT_CONFIGURED", "No dataset configured for product context"),
    INVALID_DATASET_NAME("INVALID_DATASET_NAME", "Configured dataset name is not a valid identifier"),

    // Data access errors
    QUERY_EXECUTION_FAILED("QUERY_EXECUTION_FAILED", "Analytics query failed"),

    // AI service errors
    AI_SERVICE_ERROR("AI_SERVICE_ERROR", "AI service error"),
    INVALID_AI_RESPONSE("INVALID_AI_RESPONSE", "Invalid response from AI service"),

    // Authentication errors
    UNAUTHENTICATED("UNAUTHENTICATED", "Missing or invalid bearer token"),

    // Internal server errors
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "An unexpected error occurred");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
