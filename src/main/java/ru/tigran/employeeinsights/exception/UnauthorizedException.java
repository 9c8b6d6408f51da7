package ru.tigran.employeeinsights.exception;

/**
 * Thrown when credentials are wrong or the caller has no authenticated principal.
 * HTTP status: 401 Unauthorized
 */
public class UnauthorizedException extends ApplicationException {
    public UnauthorizedException(String message, String errorCode) {
        super(message, errorCode);
    }

    public UnauthorizedException(ErrorCode code) {
        super(code);
    }
}
