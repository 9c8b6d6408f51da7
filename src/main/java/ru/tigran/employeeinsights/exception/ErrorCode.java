package ru.tigran.employeeinsights.exception;

/**
 * Enum for application error codes.
 * Each code has a default message used when no more specific one is given.
 */
public enum ErrorCode {
    // Resource not found errors
    CITY_NOT_FOUND("CITY_NOT_FOUND", "City summary not found"),
    BOOKMARK_NOT_FOUND("BOOKMARK_NOT_FOUND", "Bookmark not found"),

    // Conflicts
    BOOKMARK_ALREADY_EXISTS("BOOKMARK_ALREADY_EXISTS", "Insight already bookmarked"),

    // Validation errors
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),
    INVALID_SENTIMENT_FILTER("INVALID_SENTIMENT_FILTER", "Sentiment must be one of: positive, negative, neutral, all"),
    INVALID_DATE_RANGE("INVALID_DATE_RANGE", "dateFrom must not be after dateTo"),
    MALFORMED_RECORD("MALFORMED_RECORD", "Record cannot be normalized"),

    // Authentication errors
    MISSING_AUTHENTICATION("MISSING_AUTHENTICATION", "Missing or invalid JWT token"),
    INVALID_CREDENTIALS("INVALID_CREDENTIALS", "Invalid username or password"),
    USER_INACTIVE("USER_INACTIVE", "User account is inactive"),

    // Aggregation errors
    AGGREGATION_FAILED("AGGREGATION_FAILED", "Aggregate refresh failed, re-run the refresh action"),

    // AI service errors
    AI_SERVICE_ERROR("AI_SERVICE_ERROR", "AI service error"),
    AI_SERVICE_UNAVAILABLE("AI_SERVICE_UNAVAILABLE", "AI service is temporarily unavailable"),

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
