package ru.tigran.researchsignalengine.exception;

import org.springframework.http.HttpStatus;

/**
 * Internal class used by GlobalExceptionHandler to map exception types to HTTP status codes
 * and logging levels.
 */
record ExceptionInfo(HttpStatus status, boolean shouldLogError) {
    /**
     * Returns ExceptionInfo for given ApplicationException type.
     *
     * @param exception ApplicationException instance
     * @return ExceptionInfo with status and logging configuration
     */
    static ExceptionInfo forException(ApplicationException exception) {
        if (exception instanceof ValidationException) {
            return new ExceptionInfo(HttpStatus.BAD_REQUEST, false);
        } else if (exception instanceof AnalysisExecutionException) {
            return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true);
        }
        // Default for unknown ApplicationException subtypes
        return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true);
    }
}
