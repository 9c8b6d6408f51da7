package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Response DTO for a successful login.
 */
@Schema(description = "Authentication response containing JWT token and user info")
public record AuthenticationResponse(
    @Schema(description = "ID of the authenticated user", example = "1")
    @JsonProperty("user_id")
    Long userId,

    @Schema(example = "admin")
    String username,

    @Schema(description = "ADMIN may import data and refresh aggregates, VIEWER may only read", example = "ADMIN")
    String role,

    @Schema(description = "JWT access token for API authentication",
            example = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9...")
    @JsonProperty("access_token")
    String accessToken,

    @Schema(description = "Token type, always 'Bearer'", example = "Bearer")
    @JsonProperty("token_type")
    String tokenType
) {
    public AuthenticationResponse(Long userId, String username, String role, String accessToken) {
        this(userId, username, role, accessToken, "Bearer");
    }
}
