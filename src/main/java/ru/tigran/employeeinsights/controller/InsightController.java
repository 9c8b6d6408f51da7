package ru.tigran.employeeinsights.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.employeeinsights.dto.CommonResponse;
import ru.tigran.employeeinsights.dto.DashboardResponse;
import ru.tigran.employeeinsights.dto.FeedbackRecordView;
import ru.tigran.employeeinsights.dto.InsightFilter;
import ru.tigran.employeeinsights.dto.KeywordInsightView;
import ru.tigran.employeeinsights.service.AggregationService;
import ru.tigran.employeeinsights.service.FilteredAggregationService;
import ru.tigran.employeeinsights.service.InsightQueryService;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Keyword-level insights: stored aggregate reads, on-the-fly filtered aggregation and drill-down.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/insights")
@Tag(name = "Insights", description = "Агрегаты тональности по ключевым словам")
@SecurityRequirement(name = "bearer-jwt")
public class InsightController {

    private final InsightQueryService insightQueryService;
    private final FilteredAggregationService filteredAggregationService;
    private final AggregationService aggregationService;

    public InsightController(
            InsightQueryService insightQueryService,
            FilteredAggregationService filteredAggregationService,
            AggregationService aggregationService
    ) {
        this.insightQueryService = insightQueryService;
        this.filteredAggregationService = filteredAggregationService;
        this.aggregationService = aggregationService;
    }

    @GetMapping("/summary")
    @Operation(summary = "Сохраненный агрегат по ключевым словам", description = "Сортировка по количеству упоминаний")
    public ResponseEntity<CommonResponse<List<KeywordInsightView>>> getSummary() {
        log.debug("GET /api/v1/insights/summary");
        return ResponseEntity.ok(CommonResponse.ok(insightQueryService.getSummary()));
    }

    @PostMapping("/summary/refresh")
    @Operation(summary = "Пересчитать агрегат по ключевым словам", description = "Только ADMIN")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Агрегат пересчитан"),
            @ApiResponse(responseCode = "403", description = "Требуется роль ADMIN"),
            @ApiResponse(responseCode = "500", description = "Пересчет не удался, старый агрегат сохранен")
    })
    public ResponseEntity<CommonResponse<Map<String, Integer>>> refreshSummary() {
        log.info("POST /api/v1/insights/summary/refresh");
        int count = aggregationService.recomputeKeywordAggregate();
        return ResponseEntity.ok(CommonResponse.ok(Map.of("count", count), "Keyword aggregate refreshed"));
    }

    @GetMapping("/filtered")
    @Operation(
            summary = "Агрегат с фильтрами",
            description = "Считается по исходным записям при каждом запросе. Без фильтров совпадает с сохраненным агрегатом."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Ключевые слова с рангом"),
            @ApiResponse(responseCode = "400", description = "Неверная тональность или dateFrom позже dateTo")
    })
    public ResponseEntity<CommonResponse<List<KeywordInsightView>>> getFiltered(
            @RequestParam(required = false) String search,
            @Parameter(description = "positive, negative, neutral или all")
            @RequestParam(required = false) String sentiment,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo
    ) {
        log.info("GET /api/v1/insights/filtered - search: {}, sentiment: {}, dateFrom: {}, dateTo: {}",
                search, sentiment, dateFrom, dateTo);
        InsightFilter filter = InsightFilter.of(search, sentiment, dateFrom, dateTo);
        return ResponseEntity.ok(CommonResponse.ok(filteredAggregationService.filteredKeywordAggregate(filter)));
    }

    @GetMapping("/dashboard")
    @Operation(summary = "Сводка для дашборда", description = "Итоги, доли тональностей и лучшие/худшие ключевые слова")
    public ResponseEntity<CommonResponse<DashboardResponse>> getDashboard() {
        log.debug("GET /api/v1/insights/dashboard");
        return ResponseEntity.ok(CommonResponse.ok(insightQueryService.getDashboard()));
    }

    @GetMapping("/top-positive")
    @Operation(summary = "Самые позитивные ключевые слова")
    public ResponseEntity<CommonResponse<List<KeywordInsightView>>> getTopPositive() {
        return ResponseEntity.ok(CommonResponse.ok(insightQueryService.getTopPositive()));
    }

    @GetMapping("/top-negative")
    @Operation(summary = "Самые негативные ключевые слова")
    public ResponseEntity<CommonResponse<List<KeywordInsightView>>> getTopNegative() {
        return ResponseEntity.ok(CommonResponse.ok(insightQueryService.getTopNegative()));
    }

    @GetMapping("/top-10")
    @Operation(summary = "Топ-10 ключевых слов по количеству упоминаний")
    public ResponseEntity<CommonResponse<List<KeywordInsightView>>> getTop10() {
        return ResponseEntity.ok(CommonResponse.ok(insightQueryService.getTopByVolume()));
    }

    @GetMapping("/search/{word}")
    @Operation(summary = "Поиск по ключевым словам")
    public ResponseEntity<CommonResponse<List<KeywordInsightView>>> search(@PathVariable String word) {
        log.debug("GET /api/v1/insights/search/{}", word);
        return ResponseEntity.ok(CommonResponse.ok(insightQueryService.searchKeywords(word)));
    }

    @GetMapping("/details/{keyword}")
    @Operation(summary = "Записи по ключевому слову", description = "Новые записи первыми")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Список записей"),
            @ApiResponse(responseCode = "400", description = "limit вне диапазона 1..500 или неверный диапазон дат")
    })
    public ResponseEntity<CommonResponse<List<FeedbackRecordView>>> getDetails(
            @PathVariable String keyword,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(defaultValue = "50") int limit
    ) {
        log.debug("GET /api/v1/insights/details/{} - limit: {}", keyword, limit);
        return ResponseEntity.ok(CommonResponse.ok(
                insightQueryService.getKeywordDetails(keyword, dateFrom, dateTo, limit)));
    }
}
