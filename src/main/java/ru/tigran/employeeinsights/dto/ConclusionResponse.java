package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record ConclusionResponse(
        String conclusion,
        @JsonProperty("generated_at") LocalDateTime generatedAt,
        InsightContext context
) {
}
