package ru.tigran.employeeinsights.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.employeeinsights.dto.GroupingKey;
import ru.tigran.employeeinsights.dto.InsightFilter;
import ru.tigran.employeeinsights.dto.KeywordInsightView;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Keyword aggregation restricted to a filter, computed from the fact table on every call.
 * Never reads the stored aggregate tables and never caches.
 */
@Slf4j
@Service
public class FilteredAggregationService {

    private static final Comparator<SentimentBreakdown> BY_TOTAL_DESC =
            Comparator.comparingLong(SentimentBreakdown::totalCount).reversed()
                    .thenComparing(SentimentBreakdown::key);

    private final AggregationService aggregationService;

    public FilteredAggregationService(AggregationService aggregationService) {
        this.aggregationService = aggregationService;
    }

    /**
     * @return keyword rows of the matching records, largest first, ranked from 1
     */
    @Transactional(readOnly = true)
    public List<KeywordInsightView> filteredKeywordAggregate(InsightFilter filter) {
        List<SentimentBreakdown> groups = new ArrayList<>(aggregationService.aggregate(GroupingKey.KEYWORD, filter));
        groups.sort(BY_TOTAL_DESC);

        List<KeywordInsightView> ranked = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            ranked.add(KeywordInsightView.ranked(groups.get(i), i + 1));
        }
        log.debug("Filtered aggregation {} produced {} keywords", filter, ranked.size());
        return ranked;
    }
}
