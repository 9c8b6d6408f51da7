package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Success envelope shared by all endpoints: {@code {success, data, message}}.
 * Failures use {@link ru.tigran.employeeinsights.exception.ErrorResponse}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommonResponse<T>(boolean success, T data, String message) {

    public static <T> CommonResponse<T> ok(T data) {
        return new CommonResponse<>(true, data, null);
    }

    public static <T> CommonResponse<T> ok(T data, String message) {
        return new CommonResponse<>(true, data, message);
    }
}
