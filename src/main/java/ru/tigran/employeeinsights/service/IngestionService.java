package ru.tigran.employeeinsights.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import ru.tigran.employeeinsights.dto.ImportSummary;
import ru.tigran.employeeinsights.exception.MalformedRecordException;
import ru.tigran.employeeinsights.model.FeedbackRecord;
import ru.tigran.employeeinsights.repository.CityAggregateRepository;
import ru.tigran.employeeinsights.repository.FeedbackRecordRepository;
import ru.tigran.employeeinsights.repository.KeywordAggregateRepository;

import java.util.ArrayList;
import java.util.List;

/**
 * Loads raw feedback records into the fact table and refreshes both aggregate tables afterwards.
 *
 * Records are inserted in fixed-size batches, each in its own transaction. A failed batch is
 * rolled back and counted as errors while the remaining batches still run, so a run is never
 * atomic as a whole. No deduplication is performed.
 */
@Slf4j
@Service
public class IngestionService {

    private final FeedbackRecordRepository feedbackRecordRepository;
    private final KeywordAggregateRepository keywordAggregateRepository;
    private final CityAggregateRepository cityAggregateRepository;
    private final RecordNormalizer recordNormalizer;
    private final AggregationService aggregationService;
    private final TransactionTemplate transactionTemplate;
    private final int batchSize;

    private final Counter insertedCounter;
    private final Counter failedCounter;
    private final Timer ingestionTimer;

    public IngestionService(
            FeedbackRecordRepository feedbackRecordRepository,
            KeywordAggregateRepository keywordAggregateRepository,
            CityAggregateRepository cityAggregateRepository,
            RecordNormalizer recordNormalizer,
            AggregationService aggregationService,
            TransactionTemplate transactionTemplate,
            @Value("${app.ingestion.batch-size:100}") int batchSize,
            MeterRegistry meterRegistry
    ) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("app.ingestion.batch-size must be positive, got " + batchSize);
        }
        this.feedbackRecordRepository = feedbackRecordRepository;
        this.keywordAggregateRepository = keywordAggregateRepository;
        this.cityAggregateRepository = cityAggregateRepository;
        this.recordNormalizer = recordNormalizer;
        this.aggregationService = aggregationService;
        this.transactionTemplate = transactionTemplate;
        this.batchSize = batchSize;

        this.insertedCounter = Counter.builder("ingestion.records.inserted")
                .description("Feedback records written to the fact table")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("ingestion.records.failed")
                .description("Feedback records rejected or lost with a failed batch")
                .register(meterRegistry);
        this.ingestionTimer = Timer.builder("ingestion.run.time")
                .description("Duration of a full reload or incremental append, refresh included")
                .register(meterRegistry);
    }

    /**
     * Wipes the fact table and both aggregate tables, loads {@code records} and refreshes the aggregates.
     * Destructive: everything stored before the call is gone even if every batch fails.
     */
    public ImportSummary fullReload(List<JsonNode> records) {
        return ingestionTimer.record(() -> {
            log.info("Full reload started: {} records requested", records.size());

            transactionTemplate.executeWithoutResult(status -> {
                feedbackRecordRepository.truncate();
                keywordAggregateRepository.truncate();
                cityAggregateRepository.truncate();
            });
            log.info("Fact and aggregate tables truncated");

            return ingest(0, records);
        });
    }

    /**
     * Appends {@code records} to the fact table and refreshes the aggregates.
     * Existing rows are left untouched.
     */
    public ImportSummary incrementalAppend(List<JsonNode> records) {
        return ingestionTimer.record(() -> {
            long previousCount = feedbackRecordRepository.count();
            log.info("Incremental append started: {} records requested, {} already stored",
                    records.size(), previousCount);
            return ingest(previousCount, records);
        });
    }

    private ImportSummary ingest(long previousCount, List<JsonNode> records) {
        long inserted = 0;
        long errors = 0;
        int batchCount = (records.size() + batchSize - 1) / batchSize;

        for (int from = 0, batchNumber = 1; from < records.size(); from += batchSize, batchNumber++) {
            List<JsonNode> rawBatch = records.subList(from, Math.min(from + batchSize, records.size()));

            List<FeedbackRecord> batch = new ArrayList<>(rawBatch.size());
            for (int i = 0; i < rawBatch.size(); i++) {
                try {
                    batch.add(recordNormalizer.normalize(rawBatch.get(i)));
                } catch (MalformedRecordException e) {
                    errors++;
                    log.warn("Skipping record #{}: {}", from + i, e.getMessage());
                }
            }

            if (batch.isEmpty()) {
                continue;
            }
            try {
                transactionTemplate.executeWithoutResult(status -> feedbackRecordRepository.saveAll(batch));
                inserted += batch.size();
                log.info("Batch {}/{} committed: {} records", batchNumber, batchCount, batch.size());
            } catch (DataAccessException | TransactionException e) {
                errors += batch.size();
                log.error("Batch {}/{} failed, {} records not stored: {}",
                        batchNumber, batchCount, batch.size(), e.getMessage(), e);
            }
        }

        insertedCounter.increment(inserted);
        failedCounter.increment(errors);

        aggregationService.recomputeKeywordAggregate();
        aggregationService.recomputeCityAggregate();

        ImportSummary.FinalCounts finalCounts = new ImportSummary.FinalCounts(
                feedbackRecordRepository.count(),
                keywordAggregateRepository.count(),
                cityAggregateRepository.count()
        );
        log.info("Ingestion finished: previous={}, inserted={}, errors={}, total={}",
                previousCount, inserted, errors, records.size());

        return new ImportSummary(previousCount, inserted, errors, records.size(),
                previousCount + inserted, finalCounts);
    }
}
