package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import ru.tigran.employeeinsights.model.KeywordAggregate;
import ru.tigran.employeeinsights.service.SentimentBreakdown;

import java.time.LocalDate;

/**
 * Keyword row as rendered by the insight endpoints, stored or computed on the fly.
 * {@code rank} is only present on filtered results.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeywordInsightView(
        Integer rank,
        String keyword,
        long totalCount,
        long positiveCount,
        long negativeCount,
        long neutralCount,
        double positivePercentage,
        double negativePercentage,
        double neutralPercentage,
        Sentiment dominantSentiment,
        LocalDate lastSeenDate
) {
    public static KeywordInsightView from(KeywordAggregate aggregate) {
        return new KeywordInsightView(
                null,
                aggregate.getKeyword(),
                aggregate.getTotalCount(),
                aggregate.getPositiveCount(),
                aggregate.getNegativeCount(),
                aggregate.getNeutralCount(),
                aggregate.getPositivePercentage(),
                aggregate.getNegativePercentage(),
                aggregate.getNeutralPercentage(),
                aggregate.dominantSentiment(),
                aggregate.getLastSeenDate()
        );
    }

    public static KeywordInsightView ranked(SentimentBreakdown breakdown, int rank) {
        return new KeywordInsightView(
                rank,
                breakdown.key(),
                breakdown.totalCount(),
                breakdown.positiveCount(),
                breakdown.negativeCount(),
                breakdown.neutralCount(),
                breakdown.positivePercentage(),
                breakdown.negativePercentage(),
                breakdown.neutralPercentage(),
                breakdown.dominantSentiment(),
                breakdown.lastSeenDate()
        );
    }
}
