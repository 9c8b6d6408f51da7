package ru.tigran.employeeinsights.repository;

import org.springframework.data.jpa.domain.Specification;
import ru.tigran.employeeinsights.dto.GroupingKey;
import ru.tigran.employeeinsights.dto.SentimentGroup;
import ru.tigran.employeeinsights.model.FeedbackRecord;

import java.util.List;

public interface FeedbackRecordRepositoryCustom {

    /**
     * Groups the records matching {@code filter} by {@code key}, skipping records whose key is
     * null or blank. Groups come back ordered by key; empty groups cannot occur.
     */
    List<SentimentGroup> groupBySentiment(GroupingKey key, Specification<FeedbackRecord> filter);
}
