package ru.tigran.researchsignalengine.exception;

/**
 * Base exception class for all application-specific exceptions.
 * Carries an error code from {@link ErrorCode} that is returned to the client as-is.
 *
 * The analysis engine itself never throws these: it degrades to zero values on empty data.
 * They are raised at the service boundary for malformed or contradictory requests.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;

    public ApplicationException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public ApplicationException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
