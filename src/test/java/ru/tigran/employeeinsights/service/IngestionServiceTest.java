package ru.tigran.employeeinsights.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import ru.tigran.employeeinsights.dto.ImportSummary;
import ru.tigran.employeeinsights.model.FeedbackRecord;
import ru.tigran.employeeinsights.repository.CityAggregateRepository;
import ru.tigran.employeeinsights.repository.FeedbackRecordRepository;
import ru.tigran.employeeinsights.repository.KeywordAggregateRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit-тесты для IngestionService.
 * Транзакции идут через настоящий TransactionTemplate поверх мока PlatformTransactionManager.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionService unit тесты")
class IngestionServiceTest {

    private static final int BATCH_SIZE = 100;

    @Mock
    private FeedbackRecordRepository feedbackRecordRepository;

    @Mock
    private KeywordAggregateRepository keywordAggregateRepository;

    @Mock
    private CityAggregateRepository cityAggregateRepository;

    @Mock
    private AggregationService aggregationService;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Captor
    private ArgumentCaptor<List<FeedbackRecord>> batchCaptor;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SimpleMeterRegistry meterRegistry;
    private IngestionService ingestionService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        RecordNormalizer normalizer = new RecordNormalizer(
                Clock.fixed(Instant.parse("2024-06-15T00:00:00Z"), ZoneOffset.UTC));
        ingestionService = new IngestionService(
                feedbackRecordRepository,
                keywordAggregateRepository,
                cityAggregateRepository,
                normalizer,
                aggregationService,
                new TransactionTemplate(transactionManager),
                BATCH_SIZE,
                meterRegistry
        );
    }

    private List<JsonNode> records(int count) {
        List<JsonNode> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(objectMapper.createObjectNode()
                    .put("employeeName", "Employee " + i)
                    .put("date", "2024-01-10")
                    .put("kota", "Bandung")
                    .put("wordInsight", "layanan")
                    .put("sentimen", i % 2 == 0 ? "positif" : "negatif"));
        }
        return records;
    }

    @Test
    @DisplayName("fullReload - очищает таблицы и вставляет все записи")
    void fullReloadTruncatesAndInserts() {
        when(feedbackRecordRepository.count()).thenReturn(3L);
        when(keywordAggregateRepository.count()).thenReturn(1L);
        when(cityAggregateRepository.count()).thenReturn(1L);

        ImportSummary summary = ingestionService.fullReload(records(3));

        verify(feedbackRecordRepository).truncate();
        verify(keywordAggregateRepository).truncate();
        verify(cityAggregateRepository).truncate();
        verify(aggregationService).recomputeKeywordAggregate();
        verify(aggregationService).recomputeCityAggregate();

        assertEquals(0, summary.previousCount());
        assertEquals(3, summary.insertedCount());
        assertEquals(0, summary.errorCount());
        assertEquals(3, summary.totalRequested());
        assertEquals(3, summary.finalCount());
        assertEquals(new ImportSummary.FinalCounts(3, 1, 1), summary.finalCounts());
    }

    @Test
    @DisplayName("fullReload - пустой вход оставляет все таблицы пустыми")
    void fullReloadWithEmptyInput() {
        ImportSummary summary = ingestionService.fullReload(List.of());

        verify(feedbackRecordRepository).truncate();
        verify(feedbackRecordRepository, never()).saveAll(any());
        verify(aggregationService).recomputeKeywordAggregate();
        verify(aggregationService).recomputeCityAggregate();
        assertEquals(0, summary.insertedCount());
        assertEquals(0, summary.finalCount());
        assertEquals(new ImportSummary.FinalCounts(0, 0, 0), summary.finalCounts());
    }

    @Test
    @DisplayName("incrementalAppend - записи добавляются к существующим")
    void incrementalAppendKeepsExistingRows() {
        when(feedbackRecordRepository.count()).thenReturn(10L, 15L);

        ImportSummary summary = ingestionService.incrementalAppend(records(5));

        verify(feedbackRecordRepository, never()).truncate();
        assertEquals(10, summary.previousCount());
        assertEquals(5, summary.insertedCount());
        assertEquals(15, summary.finalCount());
        assertEquals(15, summary.finalCounts().feedbackRecords());
    }

    @Test
    @DisplayName("ingest - записи режутся на пакеты по 100")
    void splitsIntoBatches() {
        ingestionService.incrementalAppend(records(250));

        verify(feedbackRecordRepository, times(3)).saveAll(batchCaptor.capture());
        assertEquals(List.of(100, 100, 50), batchCaptor.getAllValues().stream().map(List::size).toList());
        verify(transactionManager, times(3)).commit(any());
    }

    @Test
    @DisplayName("ingest - одна битая запись не мешает остальным")
    void malformedRecordCountsAsSingleError() {
        List<JsonNode> input = records(5);
        input.set(2, TextNode.valueOf("not an object"));

        ImportSummary summary = ingestionService.incrementalAppend(input);

        assertEquals(4, summary.insertedCount());
        assertEquals(1, summary.errorCount());
        assertEquals(5, summary.totalRequested());
        assertEquals(1.0, meterRegistry.counter("ingestion.records.failed").count());
        assertEquals(4.0, meterRegistry.counter("ingestion.records.inserted").count());
    }

    @Test
    @DisplayName("ingest - упавший пакет считается ошибками целиком, следующие пакеты продолжают")
    void failedBatchIsCountedAndSkipped() {
        when(feedbackRecordRepository.saveAll(anyList()))
                .thenThrow(new DataIntegrityViolationException("value too long"))
                .thenAnswer(invocation -> invocation.getArgument(0));

        ImportSummary summary = ingestionService.incrementalAppend(records(150));

        assertEquals(50, summary.insertedCount());
        assertEquals(100, summary.errorCount());
        assertEquals(150, summary.totalRequested());
        verify(transactionManager).rollback(any());
        verify(aggregationService).recomputeKeywordAggregate();
    }

    @Test
    @DisplayName("ingest - insertedCount + errorCount == total")
    void countsAreConserved() {
        List<JsonNode> input = records(230);
        input.set(7, objectMapper.createObjectNode().put("date", "31/12/2024"));
        input.set(120, TextNode.valueOf("x"));
        when(feedbackRecordRepository.saveAll(anyList()))
                .thenAnswer(invocation -> invocation.getArgument(0))
                .thenThrow(new DataIntegrityViolationException("boom"))
                .thenAnswer(invocation -> invocation.getArgument(0));

        ImportSummary summary = ingestionService.incrementalAppend(input);

        assertEquals(summary.totalRequested(), summary.insertedCount() + summary.errorCount());
        assertEquals(99 + 30, summary.insertedCount());
    }

    @Test
    @DisplayName("batch-size должен быть положительным")
    void rejectsNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> new IngestionService(
                feedbackRecordRepository, keywordAggregateRepository, cityAggregateRepository,
                new RecordNormalizer(Clock.systemUTC()), aggregationService,
                new TransactionTemplate(transactionManager), 0, meterRegistry));
    }
}
