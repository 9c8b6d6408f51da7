package ru.tigran.employeeinsights.repository;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;
import ru.tigran.employeeinsights.dto.InsightFilter;
import ru.tigran.employeeinsights.model.FeedbackRecord;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Translates an {@link InsightFilter} into a JPA predicate over {@link FeedbackRecord}.
 * The same predicate drives the paginated listing and every grouping query.
 */
public final class FeedbackRecordSpecifications {

    private static final char ESCAPE = '\\';

    private FeedbackRecordSpecifications() {
    }

    public static Specification<FeedbackRecord> matching(InsightFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (filter.search() != null) {
                String pattern = "%" + escapeLike(filter.search().toLowerCase(Locale.ROOT)) + "%";
                predicates.add(cb.or(
                        containsIgnoreCase(cb, root.get("sentenceInsight"), pattern),
                        containsIgnoreCase(cb, root.get("originalInsight"), pattern),
                        containsIgnoreCase(cb, root.get("keyword"), pattern)
                ));
            }
            if (filter.sentiment() != null) {
                predicates.add(cb.equal(root.get("sentiment"), filter.sentiment()));
            }
            if (filter.dateFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<LocalDate>get("eventDate"), filter.dateFrom()));
            }
            if (filter.dateTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<LocalDate>get("eventDate"), filter.dateTo()));
            }
            if (filter.city() != null) {
                predicates.add(cb.equal(root.get("city"), filter.city()));
            }
            if (filter.source() != null) {
                predicates.add(cb.equal(root.get("sourceData"), filter.source()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    public static Specification<FeedbackRecord> hasKeyword(String keyword) {
        return (root, query, cb) -> cb.equal(root.get("keyword"), keyword);
    }

    private static Predicate containsIgnoreCase(CriteriaBuilder cb, Expression<String> field, String pattern) {
        return cb.like(cb.lower(field), pattern, ESCAPE);
    }

    static String escapeLike(String value) {
        return value
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
