package ru.tigran.employeeinsights.exception;

import org.springframework.http.HttpStatus;

/**
 * Internal class used by GlobalExceptionHandler to map exception types to HTTP status codes
 * and logging levels.
 */
record ExceptionInfo(HttpStatus status, boolean shouldLogError) {

    static ExceptionInfo forException(ApplicationException exception) {
        if (exception instanceof ResourceNotFoundException) {
            return new ExceptionInfo(HttpStatus.NOT_FOUND, false);
        } else if (exception instanceof UnauthorizedException) {
            return new ExceptionInfo(HttpStatus.UNAUTHORIZED, false);
        } else if (exception instanceof ValidationException || exception instanceof MalformedRecordException) {
            return new ExceptionInfo(HttpStatus.BAD_REQUEST, false);
        } else if (exception instanceof ConflictException) {
            return new ExceptionInfo(HttpStatus.CONFLICT, false);
        } else if (exception instanceof AIGatewayException) {
            return new ExceptionInfo(HttpStatus.BAD_GATEWAY, true);
        }
        // AggregationException and unknown subtypes
        return new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true);
    }
}
