package ru.tigran.employeeinsights.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import ru.tigran.employeeinsights.model.Bookmark;

import java.time.LocalDateTime;

/**
 * A bookmark with the current aggregate of its keyword, or a null summary when
 * the keyword no longer exists in the stored aggregate.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BookmarkView(
        Long id,
        Long insightId,
        String insightTitle,
        LocalDateTime createdAt,
        KeywordInsightView summary
) {
    public static BookmarkView of(Bookmark bookmark, KeywordInsightView summary) {
        return new BookmarkView(
                bookmark.getId(),
                bookmark.getInsightId(),
                bookmark.getInsightTitle(),
                bookmark.getCreatedAt(),
                summary
        );
    }
}
