package ru.tigran.employeeinsights.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.Immutable;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;
import ru.tigran.employeeinsights.dto.Sentiment;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * One classified employee-feedback sentence. Rows are never updated;
 * they disappear only when a full reload truncates the table.
 */
@Entity
@Immutable
@Table(name = "feedback_records", indexes = {
    @Index(name = "idx_feedback_keyword", columnList = "keyword"),
    @Index(name = "idx_feedback_city", columnList = "city"),
    @Index(name = "idx_feedback_event_date", columnList = "event_date"),
    @Index(name = "idx_feedback_sentiment", columnList = "sentiment")
})
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = {"originalInsight", "sentenceInsight"})
public class FeedbackRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_data", nullable = false, columnDefinition = "VARCHAR")
    private String sourceData;

    @Column(name = "employee_name", nullable = false, columnDefinition = "VARCHAR")
    private String employeeName;

    @Column(name = "event_date", nullable = false)
    private LocalDate eventDate;

    // "witel" in the source data
    @Column(nullable = false, columnDefinition = "VARCHAR")
    private String region;

    // "kota" in the source data
    @Column(nullable = false, columnDefinition = "VARCHAR")
    private String city;

    @Column(name = "original_insight", nullable = false, columnDefinition = "TEXT")
    private String originalInsight;

    @Column(name = "sentence_insight", nullable = false, columnDefinition = "TEXT")
    private String sentenceInsight;

    @Column(nullable = false, columnDefinition = "VARCHAR")
    private String keyword;

    @Column(nullable = false, length = 16)
    private Sentiment sentiment;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
