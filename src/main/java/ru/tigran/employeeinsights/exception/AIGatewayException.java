package ru.tigran.employeeinsights.exception;

/**
 * Thrown when the narrative provider call fails.
 * Wraps HTTP errors, open circuit breaker rejections and parsing failures.
 * HTTP status: 502 Bad Gateway
 *
 * Retriable for transient upstream errors (429, 502, 503, 504),
 * non-retriable for permanent ones (400, 401, 403).
 */
public class AIGatewayException extends ApplicationException {
    public AIGatewayException(String message, String errorCode, boolean retriable) {
        super(message, errorCode, retriable);
    }

    public AIGatewayException(String message, String errorCode, boolean retriable, Throwable cause) {
        super(message, errorCode, retriable, cause);
    }
}
