package ru.tigran.employeeinsights.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import ru.tigran.employeeinsights.dto.GroupingKey;
import ru.tigran.employeeinsights.dto.InsightFilter;
import ru.tigran.employeeinsights.exception.AggregationException;
import ru.tigran.employeeinsights.model.CityAggregate;
import ru.tigran.employeeinsights.model.KeywordAggregate;
import ru.tigran.employeeinsights.repository.CityAggregateRepository;
import ru.tigran.employeeinsights.repository.FeedbackRecordRepository;
import ru.tigran.employeeinsights.repository.FeedbackRecordSpecifications;
import ru.tigran.employeeinsights.repository.KeywordAggregateRepository;

import java.util.List;
import java.util.function.Supplier;

/**
 * Owns the grouping function over the fact table and the full-replace refresh of the
 * keyword and city aggregate tables built from it.
 */
@Slf4j
@Service
public class AggregationService {

    private final FeedbackRecordRepository feedbackRecordRepository;
    private final KeywordAggregateRepository keywordAggregateRepository;
    private final CityAggregateRepository cityAggregateRepository;
    private final TransactionTemplate transactionTemplate;
    private final Timer refreshTimer;

    public AggregationService(
            FeedbackRecordRepository feedbackRecordRepository,
            KeywordAggregateRepository keywordAggregateRepository,
            CityAggregateRepository cityAggregateRepository,
            TransactionTemplate transactionTemplate,
            MeterRegistry meterRegistry
    ) {
        this.feedbackRecordRepository = feedbackRecordRepository;
        this.keywordAggregateRepository = keywordAggregateRepository;
        this.cityAggregateRepository = cityAggregateRepository;
        this.transactionTemplate = transactionTemplate;
        this.refreshTimer = Timer.builder("aggregation.refresh.time")
                .description("Time spent recomputing an aggregate table")
                .register(meterRegistry);
    }

    /**
     * Groups the records matching {@code filter} by {@code key} and derives percentages.
     * An empty filter yields exactly the rows a refresh would store.
     *
     * @return one breakdown per non-empty key, ordered by key
     */
    public List<SentimentBreakdown> aggregate(GroupingKey key, InsightFilter filter) {
        return feedbackRecordRepository
                .groupBySentiment(key, FeedbackRecordSpecifications.matching(filter))
                .stream()
                .map(SentimentBreakdown::of)
                .toList();
    }

    /**
     * Replaces the keyword aggregate table with a fresh grouping of the whole fact table.
     *
     * @return number of keyword rows written
     * @throws AggregationException if the delete or the inserts fail; the transaction is rolled back
     */
    public int recomputeKeywordAggregate() {
        return refresh("keyword", () -> {
            List<KeywordAggregate> rows = aggregate(GroupingKey.KEYWORD, InsightFilter.none()).stream()
                    .map(KeywordAggregate::from)
                    .toList();
            int deleted = keywordAggregateRepository.deleteAllRows();
            keywordAggregateRepository.saveAll(rows);
            log.info("Keyword aggregate refreshed: {} rows removed, {} rows written", deleted, rows.size());
            return rows.size();
        });
    }

    /**
     * Replaces the city aggregate table with a fresh grouping of the whole fact table.
     *
     * @return number of city rows written
     * @throws AggregationException if the delete or the inserts fail; the transaction is rolled back
     */
    public int recomputeCityAggregate() {
        return refresh("city", () -> {
            List<CityAggregate> rows = aggregate(GroupingKey.CITY, InsightFilter.none()).stream()
                    .map(CityAggregate::from)
                    .toList();
            int deleted = cityAggregateRepository.deleteAllRows();
            cityAggregateRepository.saveAll(rows);
            log.info("City aggregate refreshed: {} rows removed, {} rows written", deleted, rows.size());
            return rows.size();
        });
    }

    private int refresh(String table, Supplier<Integer> work) {
        try {
            Integer written = refreshTimer.record(() -> transactionTemplate.execute(status -> work.get()));
            return written == null ? 0 : written;
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to refresh {} aggregate", table, e);
            throw new AggregationException(
                    "Failed to refresh " + table + " aggregate, run the refresh again", e);
        }
    }
}
