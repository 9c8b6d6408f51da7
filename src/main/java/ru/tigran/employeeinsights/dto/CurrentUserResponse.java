package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CurrentUserResponse(
        @JsonProperty("user_id") Long userId,
        String username,
        String role
) {
}
