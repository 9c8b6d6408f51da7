package ru.tigran.employeeinsights.exception;

/**
 * Thrown when a requested row (city summary, bookmark) does not exist.
 * HTTP status: 404 Not Found
 */
public class ResourceNotFoundException extends ApplicationException {
    public ResourceNotFoundException(String message, String errorCode) {
        super(message, errorCode);
    }
}
