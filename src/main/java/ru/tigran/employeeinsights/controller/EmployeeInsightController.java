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
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.employeeinsights.dto.CommonResponse;
import ru.tigran.employeeinsights.dto.FeedbackRecordView;
import ru.tigran.employeeinsights.dto.FeedbackStats;
import ru.tigran.employeeinsights.dto.InsightFilter;
import ru.tigran.employeeinsights.dto.MonthlyTrend;
import ru.tigran.employeeinsights.dto.PageResponse;
import ru.tigran.employeeinsights.service.FeedbackQueryService;

import java.time.LocalDate;
import java.util.List;

/**
 * Record-level reads over the fact table.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/employee-insights")
@Tag(name = "Employee insights", description = "Исходные записи отзывов, статистика и тренды")
@SecurityRequirement(name = "bearer-jwt")
public class EmployeeInsightController {

    private final FeedbackQueryService feedbackQueryService;

    public EmployeeInsightController(FeedbackQueryService feedbackQueryService) {
        this.feedbackQueryService = feedbackQueryService;
    }

    @GetMapping("/paginated")
    @Operation(
            summary = "Записи постранично",
            description = "Фильтры комбинируются через AND. Страницы нумеруются с 1."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Страница записей и пагинация"),
            @ApiResponse(responseCode = "400", description = "Неверные page/limit, тональность или диапазон дат")
    })
    public ResponseEntity<CommonResponse<PageResponse<FeedbackRecordView>>> getRecords(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit,
            @RequestParam(required = false) String search,
            @Parameter(description = "positive, negative, neutral или all")
            @RequestParam(required = false) String sentiment,
            @RequestParam(required = false) String kota,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo
    ) {
        log.info("GET /api/v1/employee-insights/paginated - page: {}, limit: {}, search: {}, sentiment: {}, kota: {}",
                page, limit, search, sentiment, kota);
        InsightFilter filter = InsightFilter.of(search, sentiment, dateFrom, dateTo).withLocation(kota, source);
        return ResponseEntity.ok(CommonResponse.ok(feedbackQueryService.getRecords(filter, page, limit)));
    }

    @GetMapping("/stats")
    @Operation(summary = "Общая статистика", description = "Число сотрудников, записей и распределение тональностей")
    public ResponseEntity<CommonResponse<FeedbackStats>> getStats() {
        log.debug("GET /api/v1/employee-insights/stats");
        return ResponseEntity.ok(CommonResponse.ok(feedbackQueryService.getStats()));
    }

    @GetMapping("/monthly-trends")
    @Operation(summary = "Тренды по месяцам", description = "Последние 12 месяцев с данными, по возрастанию")
    public ResponseEntity<CommonResponse<List<MonthlyTrend>>> getMonthlyTrends() {
        log.debug("GET /api/v1/employee-insights/monthly-trends");
        return ResponseEntity.ok(CommonResponse.ok(feedbackQueryService.getMonthlyTrends()));
    }
}
