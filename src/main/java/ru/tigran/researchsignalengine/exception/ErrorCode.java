package ru.tigran.researchsignalengine.exception;

/**
 * Enum for application error codes.
 * Centralizes all error code definitions to avoid magic strings.
 * Each code has a default message for logging purposes.
 */
public enum ErrorCode {
    // Validation errors
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),
    MALFORMED_REQUEST("MALFORMED_REQUEST", "Request body could not be read"),
    UNKNOWN_GROUP("UNKNOWN_GROUP", "Group filter references an unknown codebook group"),

    // Analysis errors
    ANALYSIS_FAILED("ANALYSIS_FAILED", "Analysis could not be completed"),

    // Generic errors
    NOT_FOUND("NOT_FOUND", "Resource not found"),
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
