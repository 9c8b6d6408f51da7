package ru.tigran.employeeinsights.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import ru.tigran.employeeinsights.config.TestConfig;
import ru.tigran.employeeinsights.dto.BookmarkRequest;
import ru.tigran.employeeinsights.dto.BookmarkView;
import ru.tigran.employeeinsights.exception.ConflictException;
import ru.tigran.employeeinsights.exception.ErrorCode;
import ru.tigran.employeeinsights.exception.ResourceNotFoundException;
import ru.tigran.employeeinsights.repository.BookmarkRepository;
import ru.tigran.employeeinsights.service.BookmarkService;
import ru.tigran.employeeinsights.service.IngestionService;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestConfig.class)
@DisplayName("Закладки: интеграционные тесты")
class BookmarkServiceIntegrationTest {

    @Autowired
    private BookmarkService bookmarkService;

    @Autowired
    private BookmarkRepository bookmarkRepository;

    @Autowired
    private IngestionService ingestionService;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        bookmarkRepository.deleteAll();
        ingestionService.fullReload(List.of(
                objectMapper.createObjectNode().put("wordInsight", "gaji").put("sentimen", "negatif"),
                objectMapper.createObjectNode().put("wordInsight", "gaji").put("sentimen", "positif")
        ));
    }

    @Test
    @DisplayName("Закладка возвращается вместе с агрегатом ключевого слова")
    void addedBookmarkCarriesSummary() {
        BookmarkView created = bookmarkService.addBookmark(new BookmarkRequest(1L, "gaji"));

        assertNotNull(created.id());
        assertNotNull(created.createdAt());
        assertNotNull(created.summary());
        assertEquals(2, created.summary().totalCount());
        assertEquals(50.0, created.summary().negativePercentage());

        List<BookmarkView> all = bookmarkService.getBookmarks();
        assertEquals(1, all.size());
        assertEquals("gaji", all.get(0).summary().keyword());
    }

    @Test
    @DisplayName("Закладка на неизвестное ключевое слово хранится без агрегата")
    void bookmarkWithoutAggregate() {
        bookmarkService.addBookmark(new BookmarkRequest(5L, "cuti"));

        BookmarkView view = bookmarkService.getBookmarks().get(0);
        assertEquals("cuti", view.insightTitle());
        assertNull(view.summary());
    }

    @Test
    @DisplayName("Повторная закладка дает конфликт")
    void duplicateBookmarkConflicts() {
        bookmarkService.addBookmark(new BookmarkRequest(1L, "gaji"));

        ConflictException exception = assertThrows(ConflictException.class,
                () -> bookmarkService.addBookmark(new BookmarkRequest(1L, " gaji ")));
        assertEquals(ErrorCode.BOOKMARK_ALREADY_EXISTS.getCode(), exception.getErrorCode());
        assertEquals(1, bookmarkRepository.count());
    }

    @Test
    @DisplayName("Удаление по ID и по паре insight_id/insight_title")
    void deletesBookmarks() {
        BookmarkView first = bookmarkService.addBookmark(new BookmarkRequest(1L, "gaji"));
        bookmarkService.addBookmark(new BookmarkRequest(2L, "gaji"));

        bookmarkService.deleteBookmark(first.id());
        bookmarkService.deleteBookmark(2L, "gaji");

        assertEquals(0, bookmarkRepository.count());
        assertThrows(ResourceNotFoundException.class, () -> bookmarkService.deleteBookmark(first.id()));
        assertThrows(ResourceNotFoundException.class, () -> bookmarkService.deleteBookmark(2L, "gaji"));
    }
}
