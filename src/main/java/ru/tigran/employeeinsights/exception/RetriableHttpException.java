package ru.tigran.employeeinsights.exception;

/**
 * Signals a transient HTTP status from the AI provider inside the retry loop.
 * Never leaves the gateway: after the last attempt it is wrapped in {@link AIGatewayException}.
 */
public class RetriableHttpException extends RuntimeException {
    private final int statusCode;

    public RetriableHttpException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
