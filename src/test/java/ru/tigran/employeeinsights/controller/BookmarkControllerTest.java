package ru.tigran.employeeinsights.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import ru.tigran.employeeinsights.config.SecurityConfig;
import ru.tigran.employeeinsights.config.TestSecurityConfig;
import ru.tigran.employeeinsights.dto.BookmarkRequest;
import ru.tigran.employeeinsights.dto.BookmarkView;
import ru.tigran.employeeinsights.exception.ConflictException;
import ru.tigran.employeeinsights.exception.ErrorCode;
import ru.tigran.employeeinsights.exception.ResourceNotFoundException;
import ru.tigran.employeeinsights.model.User;
import ru.tigran.employeeinsights.security.JwtTokenProvider;
import ru.tigran.employeeinsights.service.BookmarkService;

import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BookmarkController.class)
@Import({SecurityConfig.class, TestSecurityConfig.class})
@DisplayName("BookmarkController модульные тесты")
class BookmarkControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @MockBean
    private BookmarkService bookmarkService;

    private String token;

    @BeforeEach
    void setUp() {
        token = TestSecurityConfig.bearer(jwtTokenProvider, User.Role.VIEWER);
    }

    @Test
    @DisplayName("GET / - список закладок")
    void listBookmarks() throws Exception {
        when(bookmarkService.getBookmarks()).thenReturn(List.of(
                new BookmarkView(3L, 17L, "gaji", LocalDateTime.of(2024, 6, 1, 9, 30), null)));

        mockMvc.perform(get("/api/v1/bookmarks").header("Authorization", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id", equalTo(3)))
                .andExpect(jsonPath("$.data[0].insight_id", equalTo(17)))
                .andExpect(jsonPath("$.data[0].insight_title", equalTo("gaji")));
    }

    @Test
    @DisplayName("POST / - создание закладки 201")
    void addBookmark() throws Exception {
        when(bookmarkService.addBookmark(new BookmarkRequest(17L, "gaji"))).thenReturn(
                new BookmarkView(3L, 17L, "gaji", LocalDateTime.of(2024, 6, 1, 9, 30), null));

        mockMvc.perform(post("/api/v1/bookmarks")
                        .header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"insight_id\": 17, \"insight_title\": \"gaji\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id", equalTo(3)))
                .andExpect(jsonPath("$.message", equalTo("Bookmark added")));
    }

    @Test
    @DisplayName("POST / - повторная закладка 409")
    void duplicateBookmark() throws Exception {
        when(bookmarkService.addBookmark(any())).thenThrow(new ConflictException(ErrorCode.BOOKMARK_ALREADY_EXISTS));

        mockMvc.perform(post("/api/v1/bookmarks")
                        .header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"insight_id\": 17, \"insight_title\": \"gaji\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code", equalTo("BOOKMARK_ALREADY_EXISTS")));
    }

    @Test
    @DisplayName("POST / - без insight_title 400")
    void missingTitle() throws Exception {
        mockMvc.perform(post("/api/v1/bookmarks")
                        .header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"insight_id\": 17}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code", equalTo("VALIDATION_ERROR")));

        verifyNoInteractions(bookmarkService);
    }

    @Test
    @DisplayName("DELETE /{id} - несуществующая закладка 404")
    void deleteMissing() throws Exception {
        doThrow(new ResourceNotFoundException("Bookmark not found: 99", ErrorCode.BOOKMARK_NOT_FOUND.getCode()))
                .when(bookmarkService).deleteBookmark(99L);

        mockMvc.perform(delete("/api/v1/bookmarks/99").header("Authorization", token))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code", equalTo("BOOKMARK_NOT_FOUND")));
    }

    @Test
    @DisplayName("DELETE /insight/{insightId}/{insightTitle} - удаление по паре")
    void deleteByInsight() throws Exception {
        mockMvc.perform(delete("/api/v1/bookmarks/insight/17/gaji").header("Authorization", token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", equalTo(true)));

        verify(bookmarkService).deleteBookmark(17L, "gaji");
    }
}
