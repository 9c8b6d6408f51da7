package ru.tigran.employeeinsights.exception;

/**
 * Base exception class for all application-specific exceptions.
 * Carries an error code for the API response and a retriable flag for callers.
 *
 * Retriable exceptions indicate transient errors (e.g. an upstream 503) that can be tried again later.
 */
public abstract class ApplicationException extends RuntimeException {
    private final String errorCode;
    private final boolean retriable;

    protected ApplicationException(String message, String errorCode) {
        this(message, errorCode, false);
    }

    protected ApplicationException(String message, String errorCode, boolean retriable) {
        super(message);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    protected ApplicationException(String message, String errorCode, Throwable cause) {
        this(message, errorCode, false, cause);
    }

    protected ApplicationException(String message, String errorCode, boolean retriable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retriable = retriable;
    }

    protected ApplicationException(ErrorCode code) {
        this(code.getDefaultMessage(), code.getCode());
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * @return true if the failed operation can be repeated without changing its input
     */
    public boolean isRetriable() {
        return retriable;
    }
}
