package ru.tigran.employeeinsights.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.employeeinsights.dto.BookmarkRequest;
import ru.tigran.employeeinsights.dto.BookmarkView;
import ru.tigran.employeeinsights.dto.CommonResponse;
import ru.tigran.employeeinsights.service.BookmarkService;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/bookmarks")
@Tag(name = "Bookmarks", description = "Закладки на ключевые слова")
@SecurityRequirement(name = "bearer-jwt")
public class BookmarkController {

    private final BookmarkService bookmarkService;

    public BookmarkController(BookmarkService bookmarkService) {
        this.bookmarkService = bookmarkService;
    }

    @GetMapping
    @Operation(summary = "Все закладки", description = "Новые первыми, вместе с текущим агрегатом ключевого слова")
    public ResponseEntity<CommonResponse<List<BookmarkView>>> getBookmarks() {
        log.debug("GET /api/v1/bookmarks");
        return ResponseEntity.ok(CommonResponse.ok(bookmarkService.getBookmarks()));
    }

    @PostMapping
    @Operation(summary = "Добавить закладку")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Закладка создана"),
            @ApiResponse(responseCode = "400", description = "Не указаны insight_id или insight_title"),
            @ApiResponse(responseCode = "409", description = "Закладка уже существует")
    })
    public ResponseEntity<CommonResponse<BookmarkView>> addBookmark(@Valid @RequestBody BookmarkRequest request) {
        log.info("POST /api/v1/bookmarks - insightId: {}, title: {}", request.insightId(), request.insightTitle());

        BookmarkView bookmark = bookmarkService.addBookmark(request);

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(CommonResponse.ok(bookmark, "Bookmark added"));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Удалить закладку по ID")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Закладка удалена"),
            @ApiResponse(responseCode = "404", description = "Закладка не найдена")
    })
    public ResponseEntity<CommonResponse<Void>> deleteBookmark(@PathVariable Long id) {
        log.info("DELETE /api/v1/bookmarks/{}", id);
        bookmarkService.deleteBookmark(id);
        return ResponseEntity.ok(CommonResponse.ok(null, "Bookmark removed"));
    }

    @DeleteMapping("/insight/{insightId}/{insightTitle}")
    @Operation(summary = "Удалить закладку по insight_id и insight_title")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Закладка удалена"),
            @ApiResponse(responseCode = "404", description = "Закладка не найдена")
    })
    public ResponseEntity<CommonResponse<Void>> deleteBookmarkByInsight(
            @PathVariable Long insightId,
            @PathVariable String insightTitle
    ) {
        log.info("DELETE /api/v1/bookmarks/insight/{}/{}", insightId, insightTitle);
        bookmarkService.deleteBookmark(insightId, insightTitle);
        return ResponseEntity.ok(CommonResponse.ok(null, "Bookmark removed"));
    }
}
