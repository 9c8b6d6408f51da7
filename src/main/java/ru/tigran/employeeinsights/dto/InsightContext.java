package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Figures handed to the narrative generator for one dashboard page.
 *
 * @param topKeywords       keywords of the largest groups, largest first
 * @param filterDescription human-readable summary of the active filter
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InsightContext(
        String page,
        long totalRecords,
        long positiveCount,
        long negativeCount,
        long neutralCount,
        double positivePercentage,
        double negativePercentage,
        double neutralPercentage,
        List<String> topKeywords,
        String filterDescription
) {
}
