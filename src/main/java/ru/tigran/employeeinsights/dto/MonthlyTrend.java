package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-sentiment record counts of one calendar month, {@code month} formatted as yyyy-MM.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MonthlyTrend(
        String month,
        long positiveCount,
        long negativeCount,
        long neutralCount,
        long totalCount
) {
}
