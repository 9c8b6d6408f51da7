package ru.tigran.employeeinsights.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.employeeinsights.dto.CityInsightView;
import ru.tigran.employeeinsights.dto.CommonResponse;
import ru.tigran.employeeinsights.service.AggregationService;
import ru.tigran.employeeinsights.service.CityInsightService;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/kota-summary")
@Tag(name = "City summary", description = "Агрегаты тональности по городам")
@SecurityRequirement(name = "bearer-jwt")
public class CitySummaryController {

    private final CityInsightService cityInsightService;
    private final AggregationService aggregationService;

    public CitySummaryController(CityInsightService cityInsightService, AggregationService aggregationService) {
        this.cityInsightService = cityInsightService;
        this.aggregationService = aggregationService;
    }

    @GetMapping
    @Operation(summary = "Сводка по всем городам")
    public ResponseEntity<CommonResponse<List<CityInsightView>>> getCitySummaries() {
        log.debug("GET /api/v1/kota-summary");
        return ResponseEntity.ok(CommonResponse.ok(cityInsightService.getCitySummaries()));
    }

    @GetMapping("/{kota}")
    @Operation(summary = "Сводка по одному городу", description = "Поиск без учета регистра")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Агрегат города"),
            @ApiResponse(responseCode = "404", description = "Город не найден")
    })
    public ResponseEntity<CommonResponse<CityInsightView>> getCitySummary(@PathVariable String kota) {
        log.debug("GET /api/v1/kota-summary/{}", kota);
        return ResponseEntity.ok(CommonResponse.ok(cityInsightService.getCitySummary(kota)));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Пересчитать агрегат по городам", description = "Только ADMIN")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Агрегат пересчитан"),
            @ApiResponse(responseCode = "403", description = "Требуется роль ADMIN")
    })
    public ResponseEntity<CommonResponse<Map<String, Integer>>> refresh() {
        log.info("POST /api/v1/kota-summary/refresh");
        int count = aggregationService.recomputeCityAggregate();
        return ResponseEntity.ok(CommonResponse.ok(Map.of("count", count), "City aggregate refreshed"));
    }
}
