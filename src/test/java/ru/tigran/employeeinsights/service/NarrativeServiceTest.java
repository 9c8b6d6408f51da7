package ru.tigran.employeeinsights.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.employeeinsights.dto.ConclusionRequest;
import ru.tigran.employeeinsights.dto.ConclusionResponse;
import ru.tigran.employeeinsights.dto.GroupingKey;
import ru.tigran.employeeinsights.dto.InsightContext;
import ru.tigran.employeeinsights.dto.InsightFilter;
import ru.tigran.employeeinsights.dto.Sentiment;
import ru.tigran.employeeinsights.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NarrativeService unit тесты")
class NarrativeServiceTest {

    @Mock
    private AggregationService aggregationService;

    @Mock
    private NarrativeGenerator narrativeGenerator;

    private NarrativeService narrativeService;

    @BeforeEach
    void setUp() {
        narrativeService = new NarrativeService(aggregationService, narrativeGenerator,
                Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC));
    }

    private static SentimentBreakdown breakdown(String key, long positive, long negative, long neutral) {
        long total = positive + negative + neutral;
        return new SentimentBreakdown(key, total, positive, negative, neutral,
                SentimentBreakdown.percentage(positive, total),
                SentimentBreakdown.percentage(negative, total),
                SentimentBreakdown.percentage(neutral, total),
                LocalDate.of(2024, 5, 1));
    }

    @Test
    @DisplayName("generateConclusion - контекст собирается из отфильтрованной агрегации")
    void buildsContextFromFilteredAggregation() {
        when(aggregationService.aggregate(eq(GroupingKey.KEYWORD), any(InsightFilter.class))).thenReturn(List.of(
                breakdown("gaji", 0, 2, 0),
                breakdown("layanan", 2, 1, 0)
        ));
        when(narrativeGenerator.generate(any())).thenReturn("**SUMMARY EKSEKUTIF:** ...");

        ConclusionResponse response = narrativeService.generateConclusion(
                new ConclusionRequest(null, "lambat", "negative", null, null));

        ArgumentCaptor<InsightContext> captor = ArgumentCaptor.forClass(InsightContext.class);
        verify(narrativeGenerator).generate(captor.capture());
        InsightContext context = captor.getValue();

        assertEquals("survey-dashboard", context.page());
        assertEquals(5, context.totalRecords());
        assertEquals(2, context.positiveCount());
        assertEquals(3, context.negativeCount());
        assertEquals(40.0, context.positivePercentage());
        assertEquals(60.0, context.negativePercentage());
        assertEquals(List.of("layanan", "gaji"), context.topKeywords());
        assertEquals("search \"lambat\", sentiment negative", context.filterDescription());

        assertEquals("**SUMMARY EKSEKUTIF:** ...", response.conclusion());
        assertEquals(LocalDateTime.of(2024, 6, 15, 10, 0), response.generatedAt());

        ArgumentCaptor<InsightFilter> filter = ArgumentCaptor.forClass(InsightFilter.class);
        verify(aggregationService).aggregate(eq(GroupingKey.KEYWORD), filter.capture());
        assertEquals(Sentiment.NEGATIVE, filter.getValue().sentiment());
    }

    @Test
    @DisplayName("generateConclusion - страница городов группирует по городу")
    void cityPageGroupsByCity() {
        when(aggregationService.aggregate(eq(GroupingKey.CITY), any())).thenReturn(List.of());
        when(narrativeGenerator.generate(any())).thenReturn("ok");

        narrativeService.generateConclusion(new ConclusionRequest("kota-overview", null, null, null, null));

        verify(aggregationService).aggregate(eq(GroupingKey.CITY), any());
    }

    @Test
    @DisplayName("generateConclusion - неверная тональность не доходит до AI провайдера")
    void invalidFilterIsRejected() {
        assertThrows(ValidationException.class, () -> narrativeService.generateConclusion(
                new ConclusionRequest(null, null, "angry", null, null)));
        verifyNoInteractions(narrativeGenerator);
    }

    @Test
    void describesEmptyFilter() {
        assertEquals("all data", NarrativeService.describe(InsightFilter.none()));
        assertEquals("from 2024-01-01, to 2024-02-01", NarrativeService.describe(
                InsightFilter.of(null, null, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1))));
    }
}
