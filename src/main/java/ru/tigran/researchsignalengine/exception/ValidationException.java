package ru.tigran.researchsignalengine.exception;

/**
 * Thrown for request validation failures that bean validation cannot express.
 * Examples: group filter names a group that is not in the codebook.
 * HTTP status: 400 Bad Request
 */
public class ValidationException extends ApplicationException {
    public ValidationException(String message, String errorCode) {
        super(message, errorCode);
    }
}
