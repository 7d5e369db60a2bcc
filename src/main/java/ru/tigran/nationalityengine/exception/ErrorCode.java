package ru.tigran.nationalityengine.exception;

/**
 * Enum for application error codes.
 * Centralizes all error code definitions to avoid magic strings.
 * Each code has a default message for logging and responses.
 */
public enum ErrorCode {
    // Resource not found errors
    USER_NOT_FOUND("USER_NOT_FOUND", "User not found"),

    // Authorization errors
    UNAUTHORIZED_ACCESS("UNAUTHORIZED_ACCESS", "Unauthorized access to resource"),
    MISSING_AUTHENTICATION("MISSING_AUTHENTICATION", "Missing or invalid JWT token in Authorization header"),

    // Validation errors
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),
    INVALID_INPUT("INVALID_INPUT", "Name must not be blank"),
    INVALID_COUNTRY_CODE("INVALID_COUNTRY_CODE", "Country code must be a two-letter ISO 3166-1 alpha-2 code"),
    INVALID_LIMIT("INVALID_LIMIT", "Limit is out of the allowed range"),

    // Authentication errors
    USERNAME_ALREADY_EXISTS("USERNAME_ALREADY_EXISTS", "Username already registered"),
    INVALID_CREDENTIALS("INVALID_CREDENTIALS", "Incorrect username or password"),
    USER_INACTIVE("USER_INACTIVE", "Inactive user"),

    // Upstream service errors
    UPSTREAM_UNAVAILABLE("UPSTREAM_UNAVAILABLE", "External service is unavailable"),
    UPSTREAM_MALFORMED("UPSTREAM_MALFORMED", "External service returned an unexpected response"),
    PREDICTION_UNAVAILABLE("PREDICTION_UNAVAILABLE", "Nationality prediction is temporarily unavailable, retry later"),

    // Persistence errors
    STORE_FAILURE("STORE_FAILURE", "Storage error while processing the request"),

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
