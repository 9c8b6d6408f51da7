package ru.tigran.employeeinsights.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.employeeinsights.dto.BookmarkRequest;
import ru.tigran.employeeinsights.dto.BookmarkView;
import ru.tigran.employeeinsights.dto.KeywordInsightView;
import ru.tigran.employeeinsights.exception.ConflictException;
import ru.tigran.employeeinsights.exception.ErrorCode;
import ru.tigran.employeeinsights.exception.ResourceNotFoundException;
import ru.tigran.employeeinsights.model.Bookmark;
import ru.tigran.employeeinsights.model.KeywordAggregate;
import ru.tigran.employeeinsights.repository.BookmarkRepository;
import ru.tigran.employeeinsights.repository.KeywordAggregateRepository;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class BookmarkService {

    private final BookmarkRepository bookmarkRepository;
    private final KeywordAggregateRepository keywordAggregateRepository;

    public BookmarkService(BookmarkRepository bookmarkRepository, KeywordAggregateRepository keywordAggregateRepository) {
        this.bookmarkRepository = bookmarkRepository;
        this.keywordAggregateRepository = keywordAggregateRepository;
    }

    /**
     * All bookmarks, newest first, each joined with its keyword's stored aggregate.
     */
    @Transactional(readOnly = true)
    public List<BookmarkView> getBookmarks() {
        List<Bookmark> bookmarks = bookmarkRepository.findAllByOrderByCreatedAtDescIdDesc();
        Set<String> keywords = bookmarks.stream().map(Bookmark::getInsightTitle).collect(Collectors.toSet());
        Map<String, KeywordAggregate> aggregates = keywordAggregateRepository.findByKeywordIn(keywords).stream()
                .collect(Collectors.toMap(KeywordAggregate::getKeyword, Function.identity()));

        return bookmarks.stream()
                .map(bookmark -> {
                    KeywordAggregate aggregate = aggregates.get(bookmark.getInsightTitle());
                    return BookmarkView.of(bookmark, aggregate == null ? null : KeywordInsightView.from(aggregate));
                })
                .toList();
    }

    /**
     * @throws ConflictException if the same (record id, keyword) pair is already bookmarked
     */
    @Transactional
    public BookmarkView addBookmark(BookmarkRequest request) {
        String title = request.insightTitle().trim();
        if (bookmarkRepository.existsByInsightIdAndInsightTitle(request.insightId(), title)) {
            log.warn("Bookmark already exists: insightId={}, title={}", request.insightId(), title);
            throw new ConflictException(ErrorCode.BOOKMARK_ALREADY_EXISTS);
        }

        Bookmark bookmark = new Bookmark();
        bookmark.setInsightId(request.insightId());
        bookmark.setInsightTitle(title);
        try {
            bookmark = bookmarkRepository.saveAndFlush(bookmark);
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent insert of the same pair
            throw new ConflictException(ErrorCode.BOOKMARK_ALREADY_EXISTS);
        }
        log.info("Bookmark {} created for insight {} ({})", bookmark.getId(), bookmark.getInsightId(), title);

        KeywordInsightView summary = keywordAggregateRepository.findByKeyword(title)
                .map(KeywordInsightView::from)
                .orElse(null);
        return BookmarkView.of(bookmark, summary);
    }

    @Transactional
    public void deleteBookmark(Long id) {
        Bookmark bookmark = bookmarkRepository.findById(id)
                .orElseThrow(() -> notFound("Bookmark not found: " + id));
        bookmarkRepository.delete(bookmark);
        log.info("Bookmark {} deleted", id);
    }

    @Transactional
    public void deleteBookmark(Long insightId, String insightTitle) {
        Bookmark bookmark = bookmarkRepository.findByInsightIdAndInsightTitle(insightId, insightTitle)
                .orElseThrow(() -> notFound("Bookmark not found for insight " + insightId + " (" + insightTitle + ")"));
        bookmarkRepository.delete(bookmark);
        log.info("Bookmark {} deleted by insight {} ({})", bookmark.getId(), insightId, insightTitle);
    }

    private static ResourceNotFoundException notFound(String message) {
        return new ResourceNotFoundException(message, ErrorCode.BOOKMARK_NOT_FOUND.getCode());
    }
}
