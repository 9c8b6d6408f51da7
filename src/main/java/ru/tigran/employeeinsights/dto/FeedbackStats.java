package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FeedbackStats(
        long totalEmployees,
        long totalRecords,
        long positiveCount,
        long negativeCount,
        long neutralCount
) {
}
