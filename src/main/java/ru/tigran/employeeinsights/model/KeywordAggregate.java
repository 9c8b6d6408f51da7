package ru.tigran.employeeinsights.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import ru.tigran.employeeinsights.service.SentimentBreakdown;

/**
 * Per-keyword sentiment totals. The whole table is replaced on every refresh.
 */
@Entity
@Table(name = "keyword_aggregates", indexes = {
    @Index(name = "idx_keyword_aggregate_total", columnList = "total_count")
})
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
@ToString
public class KeywordAggregate extends SentimentAggregate {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, columnDefinition = "VARCHAR")
    private String keyword;

    public static KeywordAggregate from(SentimentBreakdown breakdown) {
        KeywordAggregate aggregate = new KeywordAggregate();
        aggregate.setKeyword(breakdown.key());
        aggregate.applyBreakdown(breakdown);
        return aggregate;
    }
}
