package ru.tigran.employeeinsights.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import ru.tigran.employeeinsights.dto.Sentiment;
import ru.tigran.employeeinsights.dto.SentimentGroup;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Доминирующая тональность и проценты")
class DominantSentimentTest {

    @ParameterizedTest(name = "({0}, {1}, {2}) -> {3}")
    @CsvSource({
            "70, 20, 10, POSITIVE",
            "33, 34, 33, NEGATIVE",
            "0, 0, 0, NEUTRAL",
            "10, 10, 80, NEUTRAL",
            "50, 50, 0, POSITIVE",
            "0, 50, 50, NEGATIVE",
            "0, 0, 100, NEUTRAL",
            "33.33, 33.33, 33.33, POSITIVE"
    })
    void picksDominantLabel(double positive, double negative, double neutral, Sentiment expected) {
        assertEquals(expected, DominantSentiment.of(positive, negative, neutral));
    }

    @Test
    @DisplayName("Проценты округляются до двух знаков, half-up")
    void percentageRoundsHalfUp() {
        assertEquals(66.67, SentimentBreakdown.percentage(2, 3));
        assertEquals(33.33, SentimentBreakdown.percentage(1, 3));
        assertEquals(12.5, SentimentBreakdown.percentage(1, 8));
        assertEquals(0.13, SentimentBreakdown.percentage(1, 800));
        assertEquals(100.0, SentimentBreakdown.percentage(7, 7));
    }

    @Test
    @DisplayName("Пустая группа дает нулевые проценты")
    void percentageOfEmptyGroupIsZero() {
        assertEquals(0.0, SentimentBreakdown.percentage(0, 0));
    }

    @Test
    void breakdownCarriesCountsAndPercentages() {
        SentimentBreakdown breakdown = SentimentBreakdown.of(
                new SentimentGroup("layanan", 3, 2, 1, 0, LocalDate.of(2024, 5, 2)));

        assertEquals("layanan", breakdown.key());
        assertEquals(3, breakdown.totalCount());
        assertEquals(66.67, breakdown.positivePercentage());
        assertEquals(33.33, breakdown.negativePercentage());
        assertEquals(0.0, breakdown.neutralPercentage());
        assertEquals(Sentiment.POSITIVE, breakdown.dominantSentiment());
        assertEquals(LocalDate.of(2024, 5, 2), breakdown.lastSeenDate());
    }
}
