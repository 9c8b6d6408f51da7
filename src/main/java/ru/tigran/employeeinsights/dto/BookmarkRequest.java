package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record BookmarkRequest(
        @NotNull(message = "insight_id is required")
        @JsonProperty("insight_id")
        @Schema(example = "42")
        Long insightId,

        @NotBlank(message = "insight_title is required")
        @Size(max = 255, message = "insight_title must be at most 255 characters")
        @JsonProperty("insight_title")
        @Schema(example = "layanan")
        String insightTitle
) {
}
