package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one ingestion run. {@code finalCount == previousCount + insertedCount};
 * a full reload reports {@code previousCount = 0}.
 */
public record ImportSummary(
        long previousCount,
        @JsonProperty("inserted") long insertedCount,
        @JsonProperty("errors") long errorCount,
        @JsonProperty("total") long totalRequested,
        long finalCount,
        FinalCounts finalCounts
) {
    public record FinalCounts(long feedbackRecords, long keywordAggregates, long cityAggregates) {
    }
}
