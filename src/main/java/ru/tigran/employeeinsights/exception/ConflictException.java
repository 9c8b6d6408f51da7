package ru.tigran.employeeinsights.exception;

/**
 * Thrown when a write would violate a uniqueness rule.
 * HTTP status: 409 Conflict
 */
public class ConflictException extends ApplicationException {
    public ConflictException(ErrorCode code) {
        super(code);
    }
}
