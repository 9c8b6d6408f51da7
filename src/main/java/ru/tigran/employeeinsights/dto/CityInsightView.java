package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import ru.tigran.employeeinsights.model.CityAggregate;

import java.time.LocalDate;
import java.time.LocalDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CityInsightView(
        String city,
        long totalCount,
        long positiveCount,
        long negativeCount,
        long neutralCount,
        double positivePercentage,
        double negativePercentage,
        double neutralPercentage,
        Sentiment dominantSentiment,
        LocalDate lastSeenDate,
        LocalDateTime updatedAt
) {
    public static CityInsightView from(CityAggregate aggregate) {
        return new CityInsightView(
                aggregate.getCity(),
                aggregate.getTotalCount(),
                aggregate.getPositiveCount(),
                aggregate.getNegativeCount(),
                aggregate.getNeutralCount(),
                aggregate.getPositivePercentage(),
                aggregate.getNegativePercentage(),
                aggregate.getNeutralPercentage(),
                aggregate.dominantSentiment(),
                aggregate.getLastSeenDate(),
                aggregate.getUpdatedAt()
        );
    }
}
