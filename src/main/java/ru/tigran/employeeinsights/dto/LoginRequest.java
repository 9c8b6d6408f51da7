package ru.tigran.employeeinsights.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for user login.
 */
public record LoginRequest(
    @NotBlank(message = "Username cannot be blank")
    @Size(max = 100, message = "Username must be at most 100 characters")
    @Schema(defaultValue = "admin")
    String username,

    @NotBlank(message = "Password cannot be blank")
    @Size(max = 128, message = "Password must be at most 128 characters")
    @Schema(defaultValue = "ChangeMe123")
    String password
) {
}
