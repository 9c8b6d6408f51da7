package ru.tigran.employeeinsights.dto;

import ru.tigran.employeeinsights.model.FeedbackRecord;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A stored record, rendered with the same field names the bulk import accepts.
 */
public record FeedbackRecordView(
        Long id,
        String sourceData,
        String employeeName,
        LocalDate date,
        String witel,
        String kota,
        String originalInsight,
        String sentenceInsight,
        String wordInsight,
        Sentiment sentimen,
        LocalDateTime createdAt
) {
    public static FeedbackRecordView from(FeedbackRecord record) {
        return new FeedbackRecordView(
                record.getId(),
                record.getSourceData(),
                record.getEmployeeName(),
                record.getEventDate(),
                record.getRegion(),
                record.getCity(),
                record.getOriginalInsight(),
                record.getSentenceInsight(),
                record.getKeyword(),
                record.getSentiment(),
                record.getCreatedAt()
        );
    }
}
