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
import ru.tigran.employeeinsights.dto.ConclusionRequest;
import ru.tigran.employeeinsights.dto.ConclusionResponse;
import ru.tigran.employeeinsights.dto.InsightContext;
import ru.tigran.employeeinsights.exception.AIGatewayException;
import ru.tigran.employeeinsights.exception.ErrorCode;
import ru.tigran.employeeinsights.model.User;
import ru.tigran.employeeinsights.security.JwtTokenProvider;
import ru.tigran.employeeinsights.service.NarrativeService;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AiConclusionController.class)
@Import({SecurityConfig.class, TestSecurityConfig.class})
@DisplayName("AiConclusionController модульные тесты")
class AiConclusionControllerTest {

    private static final String URL = "/api/v1/ai-conclusion/generate";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @MockBean
    private NarrativeService narrativeService;

    private String token;

    @BeforeEach
    void setUp() {
        token = TestSecurityConfig.bearer(jwtTokenProvider, User.Role.VIEWER);
    }

    @Test
    @DisplayName("POST /generate - вывод и контекст")
    void generate() throws Exception {
        InsightContext context = new InsightContext("top-insights", 5, 2, 3, 0, 40.0, 60.0, 0.0,
                List.of("layanan", "gaji"), "search \"gaji\"");
        when(narrativeService.generateConclusion(any())).thenReturn(
                new ConclusionResponse("SUMMARY EKSEKUTIF ...", LocalDateTime.of(2024, 6, 15, 10, 0, 30), context));

        mockMvc.perform(post(URL)
                        .header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentPage\": \"top-insights\", \"search\": \"gaji\", \"dateFrom\": \"2024-01-01\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.conclusion", startsWith("SUMMARY EKSEKUTIF")))
                .andExpect(jsonPath("$.data.generated_at", equalTo("2024-06-15T10:00:30")))
                .andExpect(jsonPath("$.data.context.total_records", equalTo(5)))
                .andExpect(jsonPath("$.data.context.top_keywords", contains("layanan", "gaji")));

        verify(narrativeService).generateConclusion(
                new ConclusionRequest("top-insights", "gaji", null, LocalDate.of(2024, 1, 1), null));
    }

    @Test
    @DisplayName("POST /generate - неизвестная страница 400")
    void unknownPage() throws Exception {
        mockMvc.perform(post(URL)
                        .header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentPage\": \"settings\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code", equalTo("VALIDATION_ERROR")));

        verifyNoInteractions(narrativeService);
    }

    @Test
    @DisplayName("POST /generate - ошибка провайдера 502")
    void providerFailure() throws Exception {
        when(narrativeService.generateConclusion(any())).thenThrow(new AIGatewayException(
                "AI service is temporarily unavailable", ErrorCode.AI_SERVICE_UNAVAILABLE.getCode(), true));

        mockMvc.perform(post(URL)
                        .header("Authorization", token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success", equalTo(false)))
                .andExpect(jsonPath("$.error_code", equalTo("AI_SERVICE_UNAVAILABLE")));
    }

    @Test
    @DisplayName("POST /generate - без токена 401")
    void withoutToken() throws Exception {
        mockMvc.perform(post(URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized());
    }
}
