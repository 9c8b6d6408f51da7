package ru.tigran.employeeinsights.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.employeeinsights.dto.CommonResponse;
import ru.tigran.employeeinsights.dto.ConclusionRequest;
import ru.tigran.employeeinsights.dto.ConclusionResponse;
import ru.tigran.employeeinsights.service.NarrativeService;

@Slf4j
@RestController
@RequestMapping("/api/v1/ai-conclusion")
@Tag(name = "AI conclusion", description = "Текстовый вывод по данным страницы дашборда")
@SecurityRequirement(name = "bearer-jwt")
public class AiConclusionController {

    private final NarrativeService narrativeService;

    public AiConclusionController(NarrativeService narrativeService) {
        this.narrativeService = narrativeService;
    }

    @PostMapping("/generate")
    @Operation(
            summary = "Сгенерировать вывод",
            description = "Собирает агрегаты с учетом фильтров и запрашивает у AI провайдера вывод на индонезийском"
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Вывод сгенерирован"),
            @ApiResponse(responseCode = "400", description = "Неверные фильтры"),
            @ApiResponse(responseCode = "502", description = "AI провайдер недоступен или вернул ошибку")
    })
    public ResponseEntity<CommonResponse<ConclusionResponse>> generate(@Valid @RequestBody ConclusionRequest request) {
        log.info("POST /api/v1/ai-conclusion/generate - page: {}, search: {}, sentiment: {}",
                request.pageOrDefault(), request.search(), request.sentiment());
        return ResponseEntity.ok(CommonResponse.ok(narrativeService.generateConclusion(request)));
    }
}
