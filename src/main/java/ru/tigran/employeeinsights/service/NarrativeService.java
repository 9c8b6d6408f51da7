package ru.tigran.employeeinsights.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.tigran.employeeinsights.dto.ConclusionRequest;
import ru.tigran.employeeinsights.dto.ConclusionResponse;
import ru.tigran.employeeinsights.dto.GroupingKey;
import ru.tigran.employeeinsights.dto.InsightContext;
import ru.tigran.employeeinsights.dto.InsightFilter;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects the figures of a dashboard page and asks the narrative generator for a conclusion.
 */
@Slf4j
@Service
public class NarrativeService {

    private static final int CONTEXT_KEYS = 10;
    private static final String CITY_PAGE = "kota-overview";

    private final AggregationService aggregationService;
    private final NarrativeGenerator narrativeGenerator;
    private final Clock clock;

    public NarrativeService(AggregationService aggregationService, NarrativeGenerator narrativeGenerator, Clock clock) {
        this.aggregationService = aggregationService;
        this.narrativeGenerator = narrativeGenerator;
        this.clock = clock;
    }

    public ConclusionResponse generateConclusion(ConclusionRequest request) {
        InsightFilter filter = InsightFilter.of(
                request.search(), request.sentiment(), request.dateFrom(), request.dateTo());
        InsightContext context = buildContext(request.pageOrDefault(), filter);

        String conclusion = narrativeGenerator.generate(context);
        log.info("Conclusion generated for page '{}' ({} records)", context.page(), context.totalRecords());
        return new ConclusionResponse(conclusion, LocalDateTime.now(clock), context);
    }

    InsightContext buildContext(String page, InsightFilter filter) {
        GroupingKey key = CITY_PAGE.equals(page) ? GroupingKey.CITY : GroupingKey.KEYWORD;
        List<SentimentBreakdown> groups = new ArrayList<>(aggregationService.aggregate(key, filter));
        groups.sort(Comparator.comparingLong(SentimentBreakdown::totalCount).reversed()
                .thenComparing(SentimentBreakdown::key));

        long positive = 0;
        long negative = 0;
        long neutral = 0;
        for (SentimentBreakdown group : groups) {
            positive += group.positiveCount();
            negative += group.negativeCount();
            neutral += group.neutralCount();
        }
        long total = positive + negative + neutral;

        return new InsightContext(
                page,
                total,
                positive,
                negative,
                neutral,
                SentimentBreakdown.percentage(positive, total),
                SentimentBreakdown.percentage(negative, total),
                SentimentBreakdown.percentage(neutral, total),
                groups.stream().limit(CONTEXT_KEYS).map(SentimentBreakdown::key).toList(),
                describe(filter)
        );
    }

    static String describe(InsightFilter filter) {
        if (filter.isEmpty()) {
            return "all data";
        }
        List<String> parts = new ArrayList<>();
        if (filter.search() != null) {
            parts.add("search \"" + filter.search() + "\"");
        }
        if (filter.sentiment() != null) {
            parts.add("sentiment " + filter.sentiment().getEnglishName());
        }
        if (filter.dateFrom() != null) {
            parts.add("from " + filter.dateFrom());
        }
        if (filter.dateTo() != null) {
            parts.add("to " + filter.dateTo());
        }
        return String.join(", ", parts);
    }
}
