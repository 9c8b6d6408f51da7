package ru.tigran.employeeinsights.exception;

/**
 * Thrown by the record normalizer for an inbound element it cannot turn into a feedback record.
 * The ingestion pipeline counts it as one failed record and never lets it reach the client.
 */
public class MalformedRecordException extends ApplicationException {
    public MalformedRecordException(String message) {
        super(message, ErrorCode.MALFORMED_RECORD.getCode());
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, ErrorCode.MALFORMED_RECORD.getCode(), cause);
    }
}
