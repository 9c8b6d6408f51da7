package ru.tigran.employeeinsights.service;

import ru.tigran.employeeinsights.dto.Sentiment;
import ru.tigran.employeeinsights.dto.SentimentGroup;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Counts and rounded percentages of one group. Both the stored aggregate tables
 * and the filtered aggregation are built from this type, so their numbers cannot drift apart.
 */
public record SentimentBreakdown(
        String key,
        long totalCount,
        long positiveCount,
        long negativeCount,
        long neutralCount,
        double positivePercentage,
        double negativePercentage,
        double neutralPercentage,
        LocalDate lastSeenDate
) {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public static SentimentBreakdown of(SentimentGroup group) {
        long total = group.totalCount();
        return new SentimentBreakdown(
                group.key(),
                total,
                group.positiveCount(),
                group.negativeCount(),
                group.neutralCount(),
                percentage(group.positiveCount(), total),
                percentage(group.negativeCount(), total),
                percentage(group.neutralCount(), total),
                group.lastSeenDate()
        );
    }

    /**
     * count / total * 100, half-up to two decimals; 0 when total is 0.
     */
    public static double percentage(long count, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(count)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public Sentiment dominantSentiment() {
        return DominantSentiment.of(positivePercentage, negativePercentage, neutralPercentage);
    }
}
