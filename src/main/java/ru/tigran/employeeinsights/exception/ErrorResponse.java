package ru.tigran.employeeinsights.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Error body returned by every failed API call.
 */
@Schema(description = "Error response")
public record ErrorResponse(
        @Schema(example = "false")
        boolean success,

        @Schema(example = "VALIDATION_ERROR")
        @JsonProperty("error_code")
        String errorCode,

        String message
) {
    public ErrorResponse(String errorCode, String message) {
        this(false, errorCode, message);
    }
}
