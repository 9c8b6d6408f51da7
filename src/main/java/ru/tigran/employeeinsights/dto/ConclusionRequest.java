package ru.tigran.employeeinsights.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Pattern;

import java.time.LocalDate;

/**
 * Page and filter the conclusion is written for. All fields are optional.
 */
public record ConclusionRequest(
        @Pattern(regexp = "survey-dashboard|top-insights|kota-overview",
                message = "page must be one of survey-dashboard, top-insights, kota-overview")
        @Schema(example = "survey-dashboard")
        String currentPage,

        String search,

        @Schema(example = "all")
        String sentiment,

        LocalDate dateFrom,

        LocalDate dateTo
) {
    public String pageOrDefault() {
        return currentPage == null || currentPage.isBlank() ? "survey-dashboard" : currentPage;
    }
}
