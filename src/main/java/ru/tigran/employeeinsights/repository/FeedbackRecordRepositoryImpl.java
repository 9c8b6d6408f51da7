package ru.tigran.employeeinsights.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;
import ru.tigran.employeeinsights.dto.GroupingKey;
import ru.tigran.employeeinsights.dto.Sentiment;
import ru.tigran.employeeinsights.dto.SentimentGroup;
import ru.tigran.employeeinsights.model.FeedbackRecord;

import java.time.LocalDate;
import java.util.List;

public class FeedbackRecordRepositoryImpl implements FeedbackRecordRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<SentimentGroup> groupBySentiment(GroupingKey key, Specification<FeedbackRecord> filter) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<FeedbackRecord> root = query.from(FeedbackRecord.class);

        Path<String> groupKey = root.get(key.getAttribute());
        Path<LocalDate> eventDate = root.get("eventDate");

        Predicate keyPresent = cb.and(cb.isNotNull(groupKey), cb.notEqual(cb.trim(groupKey), ""));
        Predicate matches = filter.toPredicate(root, query, cb);
        query.where(matches == null ? keyPresent : cb.and(matches, keyPresent));

        query.multiselect(
                groupKey,
                cb.count(root),
                countOf(cb, root, Sentiment.POSITIVE),
                countOf(cb, root, Sentiment.NEGATIVE),
                countOf(cb, root, Sentiment.NEUTRAL),
                cb.greatest(eventDate)
        );
        query.groupBy(groupKey);
        query.orderBy(cb.asc(groupKey));

        return entityManager.createQuery(query).getResultList().stream()
                .map(tuple -> new SentimentGroup(
                        tuple.get(0, String.class),
                        asLong(tuple.get(1)),
                        asLong(tuple.get(2)),
                        asLong(tuple.get(3)),
                        asLong(tuple.get(4)),
                        tuple.get(5, LocalDate.class)
                ))
                .toList();
    }

    private static Expression<Long> countOf(CriteriaBuilder cb, Root<FeedbackRecord> root, Sentiment sentiment) {
        return cb.sum(cb.<Long>selectCase()
                .when(cb.equal(root.get("sentiment"), sentiment), 1L)
                .otherwise(0L));
    }

    // SUM over a CASE comes back as Long, BigInteger or BigDecimal depending on the database
    private static long asLong(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }
}
