package ru.tigran.employeeinsights.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.employeeinsights.dto.DashboardResponse;
import ru.tigran.employeeinsights.dto.FeedbackRecordView;
import ru.tigran.employeeinsights.dto.InsightFilter;
import ru.tigran.employeeinsights.dto.KeywordInsightView;
import ru.tigran.employeeinsights.exception.ErrorCode;
import ru.tigran.employeeinsights.exception.ValidationException;
import ru.tigran.employeeinsights.model.KeywordAggregate;
import ru.tigran.employeeinsights.repository.FeedbackRecordRepository;
import ru.tigran.employeeinsights.repository.FeedbackRecordSpecifications;
import ru.tigran.employeeinsights.repository.KeywordAggregateRepository;

import java.time.LocalDate;
import java.util.List;

/**
 * Read side of the keyword insights: stored aggregate lookups and raw record drill-down.
 */
@Slf4j
@Service
public class InsightQueryService {

    private static final int TOP_LIMIT = 10;
    private static final int DASHBOARD_TOP_LIMIT = 5;
    private static final int MAX_DETAIL_LIMIT = 500;

    private final KeywordAggregateRepository keywordAggregateRepository;
    private final FeedbackRecordRepository feedbackRecordRepository;
    private final double topThreshold;

    public InsightQueryService(
            KeywordAggregateRepository keywordAggregateRepository,
            FeedbackRecordRepository feedbackRecordRepository,
            @Value("${app.insights.top-threshold:70}") double topThreshold
    ) {
        this.keywordAggregateRepository = keywordAggregateRepository;
        this.feedbackRecordRepository = feedbackRecordRepository;
        this.topThreshold = topThreshold;
    }

    @Transactional(readOnly = true)
    public List<KeywordInsightView> getSummary() {
        return toViews(keywordAggregateRepository.findAllByOrderByTotalCountDescKeywordAsc());
    }

    @Transactional(readOnly = true)
    public List<KeywordInsightView> getTopByVolume() {
        return toViews(keywordAggregateRepository.findAllByOrderByTotalCountDescKeywordAsc(
                PageRequest.of(0, TOP_LIMIT)));
    }

    @Transactional(readOnly = true)
    public List<KeywordInsightView> getTopPositive() {
        return getTopPositive(TOP_LIMIT);
    }

    @Transactional(readOnly = true)
    public List<KeywordInsightView> getTopNegative() {
        return getTopNegative(TOP_LIMIT);
    }

    @Transactional(readOnly = true)
    public List<KeywordInsightView> searchKeywords(String word) {
        return toViews(keywordAggregateRepository.findByKeywordContainingIgnoreCaseOrderByTotalCountDesc(word.trim()));
    }

    /**
     * Totals and ratios over all stored keywords plus the strongest positive and negative ones.
     */
    @Transactional(readOnly = true)
    public DashboardResponse getDashboard() {
        List<KeywordAggregate> aggregates = keywordAggregateRepository.findAllByOrderByTotalCountDescKeywordAsc();

        long positive = 0;
        long negative = 0;
        long neutral = 0;
        long total = 0;
        for (KeywordAggregate aggregate : aggregates) {
            positive += aggregate.getPositiveCount();
            negative += aggregate.getNegativeCount();
            neutral += aggregate.getNeutralCount();
            total += aggregate.getTotalCount();
        }

        return new DashboardResponse(
                aggregates.size(),
                total,
                positive,
                negative,
                neutral,
                SentimentBreakdown.percentage(positive, total),
                SentimentBreakdown.percentage(negative, total),
                SentimentBreakdown.percentage(neutral, total),
                getTopPositive(DASHBOARD_TOP_LIMIT),
                getTopNegative(DASHBOARD_TOP_LIMIT),
                toViews(aggregates)
        );
    }

    /**
     * Raw records behind one keyword, newest first.
     *
     * @param limit maximum number of records, 1 to 500
     */
    @Transactional(readOnly = true)
    public List<FeedbackRecordView> getKeywordDetails(String keyword, LocalDate dateFrom, LocalDate dateTo, int limit) {
        if (limit < 1 || limit > MAX_DETAIL_LIMIT) {
            throw new ValidationException(
                    "limit must be between 1 and " + MAX_DETAIL_LIMIT,
                    ErrorCode.VALIDATION_ERROR.getCode()
            );
        }
        InsightFilter dateRange = new InsightFilter(null, null, dateFrom, dateTo, null, null);
        PageRequest page = PageRequest.of(0, limit,
                Sort.by(Sort.Direction.DESC, "eventDate").and(Sort.by(Sort.Direction.DESC, "id")));

        List<FeedbackRecordView> records = feedbackRecordRepository
                .findAll(FeedbackRecordSpecifications.hasKeyword(keyword)
                        .and(FeedbackRecordSpecifications.matching(dateRange)), page)
                .map(FeedbackRecordView::from)
                .getContent();
        log.debug("Keyword '{}' details: {} records", keyword, records.size());
        return records;
    }

    private List<KeywordInsightView> getTopPositive(int limit) {
        return toViews(keywordAggregateRepository
                .findByPositivePercentageGreaterThanOrderByPositivePercentageDescTotalCountDesc(
                        topThreshold, PageRequest.of(0, limit)));
    }

    private List<KeywordInsightView> getTopNegative(int limit) {
        return toViews(keywordAggregateRepository
                .findByNegativePercentageGreaterThanOrderByNegativePercentageDescTotalCountDesc(
                        topThreshold, PageRequest.of(0, limit)));
    }

    private static List<KeywordInsightView> toViews(List<KeywordAggregate> aggregates) {
        return aggregates.stream().map(KeywordInsightView::from).toList();
    }
}
