package ru.tigran.employeeinsights.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.employeeinsights.dto.FeedbackRecordView;
import ru.tigran.employeeinsights.dto.FeedbackStats;
import ru.tigran.employeeinsights.dto.InsightFilter;
import ru.tigran.employeeinsights.dto.MonthlySentimentCount;
import ru.tigran.employeeinsights.dto.MonthlyTrend;
import ru.tigran.employeeinsights.dto.PageResponse;
import ru.tigran.employeeinsights.dto.Sentiment;
import ru.tigran.employeeinsights.exception.ErrorCode;
import ru.tigran.employeeinsights.exception.ValidationException;
import ru.tigran.employeeinsights.repository.FeedbackRecordRepository;
import ru.tigran.employeeinsights.repository.FeedbackRecordSpecifications;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Read-only queries over the fact table: paginated listing, headline stats and monthly trends.
 */
@Slf4j
@Service
public class FeedbackQueryService {

    private static final int MAX_PAGE_SIZE = 100;
    private static final int TREND_MONTHS = 12;

    private final FeedbackRecordRepository feedbackRecordRepository;

    public FeedbackQueryService(FeedbackRecordRepository feedbackRecordRepository) {
        this.feedbackRecordRepository = feedbackRecordRepository;
    }

    /**
     * Lists matching records, newest event date first.
     *
     * @param page  1-based page number
     * @param limit page size, 1 to 100
     */
    @Transactional(readOnly = true)
    public PageResponse<FeedbackRecordView> getRecords(InsightFilter filter, int page, int limit) {
        if (page < 1) {
            throw new ValidationException("page must be at least 1", ErrorCode.VALIDATION_ERROR.getCode());
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ValidationException(
                    "limit must be between 1 and " + MAX_PAGE_SIZE,
                    ErrorCode.VALIDATION_ERROR.getCode()
            );
        }

        PageRequest pageRequest = PageRequest.of(page - 1, limit,
                Sort.by(Sort.Direction.DESC, "eventDate").and(Sort.by(Sort.Direction.DESC, "id")));
        Page<FeedbackRecordView> result = feedbackRecordRepository
                .findAll(FeedbackRecordSpecifications.matching(filter), pageRequest)
                .map(FeedbackRecordView::from);

        log.debug("Fetched page {} of records ({} of {} total)", page, result.getNumberOfElements(),
                result.getTotalElements());

        return new PageResponse<>(
                result.getContent(),
                new PageResponse.Pagination(page, limit, result.getTotalElements(), result.getTotalPages())
        );
    }

    @Transactional(readOnly = true)
    public FeedbackStats getStats() {
        return new FeedbackStats(
                feedbackRecordRepository.countDistinctEmployees(),
                feedbackRecordRepository.count(),
                feedbackRecordRepository.countBySentiment(Sentiment.POSITIVE),
                feedbackRecordRepository.countBySentiment(Sentiment.NEGATIVE),
                feedbackRecordRepository.countBySentiment(Sentiment.NEUTRAL)
        );
    }

    /**
     * Per-sentiment counts for the latest twelve months that have records, oldest first.
     */
    @Transactional(readOnly = true)
    public List<MonthlyTrend> getMonthlyTrends() {
        NavigableMap<YearMonth, Map<Sentiment, Long>> byMonth = new TreeMap<>();
        for (MonthlySentimentCount row : feedbackRecordRepository.countByMonthAndSentiment()) {
            byMonth.computeIfAbsent(YearMonth.of(row.year(), row.month()), m -> new EnumMap<>(Sentiment.class))
                    .merge(row.sentiment(), row.count(), Long::sum);
        }

        while (byMonth.size() > TREND_MONTHS) {
            byMonth.pollFirstEntry();
        }

        List<MonthlyTrend> trends = new ArrayList<>(byMonth.size());
        byMonth.forEach((month, counts) -> {
            long positive = counts.getOrDefault(Sentiment.POSITIVE, 0L);
            long negative = counts.getOrDefault(Sentiment.NEGATIVE, 0L);
            long neutral = counts.getOrDefault(Sentiment.NEUTRAL, 0L);
            trends.add(new MonthlyTrend(month.toString(), positive, negative, neutral, positive + negative + neutral));
        });
        return trends;
    }
}
