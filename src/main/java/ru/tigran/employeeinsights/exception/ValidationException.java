package ru.tigran.employeeinsights.exception;

/**
 * Thrown for request validation failures that bean validation cannot express.
 * Examples: unknown sentiment filter, reversed date range, payload without a data array.
 * HTTP status: 400 Bad Request
 */
public class ValidationException extends ApplicationException {
    public ValidationException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ValidationException(ErrorCode code) {
        super(code);
    }
}
