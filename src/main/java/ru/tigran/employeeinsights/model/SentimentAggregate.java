package ru.tigran.employeeinsights.model;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;
import ru.tigran.employeeinsights.dto.Sentiment;
import ru.tigran.employeeinsights.service.DominantSentiment;
import ru.tigran.employeeinsights.service.SentimentBreakdown;

import java.time.LocalDate;

/**
 * Counts and percentages shared by the keyword and city aggregate tables.
 * Percentages are rounded independently, so their sum may differ from 100 by a few hundredths.
 */
@Getter
@Setter
@MappedSuperclass
public abstract class SentimentAggregate extends AuditableEntity {

    @Column(name = "total_count", nullable = false)
    private long totalCount;

    @Column(name = "positive_count", nullable = false)
    private long positiveCount;

    @Column(name = "negative_count", nullable = false)
    private long negativeCount;

    @Column(name = "neutral_count", nullable = false)
    private long neutralCount;

    @Column(name = "positive_percentage", nullable = false)
    private double positivePercentage;

    @Column(name = "negative_percentage", nullable = false)
    private double negativePercentage;

    @Column(name = "neutral_percentage", nullable = false)
    private double neutralPercentage;

    @Column(name = "last_seen_date")
    private LocalDate lastSeenDate;

    protected void applyBreakdown(SentimentBreakdown breakdown) {
        this.totalCount = breakdown.totalCount();
        this.positiveCount = breakdown.positiveCount();
        this.negativeCount = breakdown.negativeCount();
        this.neutralCount = breakdown.neutralCount();
        this.positivePercentage = breakdown.positivePercentage();
        this.negativePercentage = breakdown.negativePercentage();
        this.neutralPercentage = breakdown.neutralPercentage();
        this.lastSeenDate = breakdown.lastSeenDate();
    }

    public Sentiment dominantSentiment() {
        return DominantSentiment.of(positivePercentage, negativePercentage, neutralPercentage);
    }
}
