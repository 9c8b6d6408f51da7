package ru.tigran.employeeinsights.exception;

/**
 * Thrown when recomputing a stored aggregate table fails.
 * The table is left as it was before the refresh; running the refresh again is safe.
 * HTTP status: 500 Internal Server Error
 */
public class AggregationException extends ApplicationException {
    public AggregationException(String message, Throwable cause) {
        super(message, ErrorCode.AGGREGATION_FAILED.getCode(), true, cause);
    }
}
