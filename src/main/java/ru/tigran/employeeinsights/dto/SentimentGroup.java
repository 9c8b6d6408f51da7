package ru.tigran.employeeinsights.dto;

import java.time.LocalDate;

/**
 * Raw per-group counts produced by the grouping query, before percentages are derived.
 */
public record SentimentGroup(
        String key,
        long totalCount,
        long positiveCount,
        long negativeCount,
        long neutralCount,
        LocalDate lastSeenDate
) {
}
