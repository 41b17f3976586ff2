package ru.tigran.researchsignalengine.exception;

/**
 * Thrown when a concurrently executed analysis fails or is interrupted.
 * HTTP status: 500 Internal Server Error
 */
public class AnalysisExecutionException extends ApplicationException {
    public AnalysisExecutionException(String message, String errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }
}
