package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Everything the dashboard landing page shows, derived from the stored keyword aggregate.
 * Ratios are percentages of all records, rounded to two decimals.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DashboardResponse(
        long totalKeywords,
        long totalRecords,
        long positiveCount,
        long negativeCount,
        long neutralCount,
        double positiveRatio,
        double negativeRatio,
        double neutralRatio,
        List<KeywordInsightView> topPositive,
        List<KeywordInsightView> topNegative,
        List<KeywordInsightView> insights
) {
}
