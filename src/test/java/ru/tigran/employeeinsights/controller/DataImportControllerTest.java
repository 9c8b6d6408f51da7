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
import ru.tigran.employeeinsights.dto.ImportSummary;
import ru.tigran.employeeinsights.model.User;
import ru.tigran.employeeinsights.security.JwtTokenProvider;
import ru.tigran.employeeinsights.service.IngestionService;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(DataImportController.class)
@Import({SecurityConfig.class, TestSecurityConfig.class})
@DisplayName("DataImportController модульные тесты")
class DataImportControllerTest {

    private static final String IMPORT_URL = "/api/v1/data/import";
    private static final String INCREMENTAL_URL = "/api/v1/data/import-incremental";
    private static final String BODY = """
            {"data": [
              {"employeeName": "Budi", "wordInsight": "layanan", "sentimen": "positif"},
              "broken",
              {"employeeName": "Sari", "wordInsight": "gaji", "sentimen": "negatif"}
            ]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @MockBean
    private IngestionService ingestionService;

    private String adminToken;

    @BeforeEach
    void setUp() {
        adminToken = TestSecurityConfig.bearer(jwtTokenProvider, User.Role.ADMIN);
    }

    @Test
    @DisplayName("POST /import - сводка импорта в ответе")
    void fullReload() throws Exception {
        when(ingestionService.fullReload(anyList())).thenReturn(
                new ImportSummary(0, 2, 1, 3, 2, new ImportSummary.FinalCounts(2, 2, 1)));

        mockMvc.perform(post(IMPORT_URL)
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", equalTo(true)))
                .andExpect(jsonPath("$.data.previousCount", equalTo(0)))
                .andExpect(jsonPath("$.data.inserted", equalTo(2)))
                .andExpect(jsonPath("$.data.errors", equalTo(1)))
                .andExpect(jsonPath("$.data.total", equalTo(3)))
                .andExpect(jsonPath("$.data.finalCount", equalTo(2)))
                .andExpect(jsonPath("$.data.finalCounts.keywordAggregates", equalTo(2)))
                .andExpect(jsonPath("$.message", containsString("2 inserted")));

        verify(ingestionService).fullReload(argThat(list -> list.size() == 3));
    }

    @Test
    @DisplayName("POST /import-incremental - вызывает инкрементальную загрузку")
    void incrementalAppend() throws Exception {
        when(ingestionService.incrementalAppend(anyList())).thenReturn(
                new ImportSummary(5, 2, 1, 3, 7, new ImportSummary.FinalCounts(7, 3, 2)));

        mockMvc.perform(post(INCREMENTAL_URL)
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.previousCount", equalTo(5)))
                .andExpect(jsonPath("$.data.finalCount", equalTo(7)));

        verify(ingestionService, never()).fullReload(any());
    }

    @Test
    @DisplayName("POST /import - без массива data 400")
    void rejectsMissingData() throws Exception {
        mockMvc.perform(post(IMPORT_URL)
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code", equalTo("VALIDATION_ERROR")));

        verifyNoInteractions(ingestionService);
    }

    @Test
    @DisplayName("POST /import - data не массив 400")
    void rejectsNonArrayData() throws Exception {
        mockMvc.perform(post(IMPORT_URL)
                        .header("Authorization", adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\": 42}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(ingestionService);
    }

    @Test
    @DisplayName("POST /import - VIEWER получает 403")
    void viewerIsForbidden() throws Exception {
        mockMvc.perform(post(IMPORT_URL)
                        .header("Authorization", TestSecurityConfig.bearer(jwtTokenProvider, User.Role.VIEWER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isForbidden());

        verifyNoInteractions(ingestionService);
    }

    @Test
    @DisplayName("POST /import - без токена 401")
    void anonymousIsUnauthorized() throws Exception {
        mockMvc.perform(post(IMPORT_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isUnauthorized());
    }
}
