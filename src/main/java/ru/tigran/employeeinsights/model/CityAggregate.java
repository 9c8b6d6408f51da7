package ru.tigran.employeeinsights.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import ru.tigran.employeeinsights.service.SentimentBreakdown;

/**
 * Per-city sentiment totals. Refreshed by its own action, independently of the keyword table.
 */
@Entity
@Table(name = "city_aggregates", indexes = {
    @Index(name = "idx_city_aggregate_total", columnList = "total_count")
})
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
@ToString
public class CityAggregate extends SentimentAggregate {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, columnDefinition = "VARCHAR")
    private String city;

    public static CityAggregate from(SentimentBreakdown breakdown) {
        CityAggregate aggregate = new CityAggregate();
        aggregate.setCity(breakdown.key());
        aggregate.applyBreakdown(breakdown);
        return aggregate;
    }
}
