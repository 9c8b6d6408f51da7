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
import ru.tigran.employeeinsights.dto.BulkImportRequest;
import ru.tigran.employeeinsights.dto.CommonResponse;
import ru.tigran.employeeinsights.dto.ImportSummary;
import ru.tigran.employeeinsights.service.IngestionService;

@Slf4j
@RestController
@RequestMapping("/api/v1/data")
@Tag(name = "Data import", description = "Загрузка отзывов сотрудников (только ADMIN)")
@SecurityRequirement(name = "bearer-jwt")
public class DataImportController {

    private final IngestionService ingestionService;

    public DataImportController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping("/import")
    @Operation(
            summary = "Полная перезагрузка данных",
            description = "Удаляет все записи и агрегаты, загружает переданные записи пакетами по 100 " +
                    "и пересчитывает агрегаты по ключевым словам и городам."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Импорт завершен, в ответе счетчики вставок и ошибок"),
            @ApiResponse(responseCode = "400", description = "Тело запроса не содержит массив data"),
            @ApiResponse(responseCode = "403", description = "Требуется роль ADMIN")
    })
    public ResponseEntity<CommonResponse<ImportSummary>> fullReload(@Valid @RequestBody BulkImportRequest request) {
        log.info("POST /api/v1/data/import - records: {}", request.data().size());

        ImportSummary summary = ingestionService.fullReload(request.data());

        return ResponseEntity.ok(CommonResponse.ok(summary, String.format(
                "Full reload finished: %d inserted, %d errors", summary.insertedCount(), summary.errorCount())));
    }

    @PostMapping("/import-incremental")
    @Operation(
            summary = "Инкрементальная загрузка",
            description = "Добавляет записи к существующим и пересчитывает агрегаты"
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Импорт завершен"),
            @ApiResponse(responseCode = "400", description = "Тело запроса не содержит массив data"),
            @ApiResponse(responseCode = "403", description = "Требуется роль ADMIN")
    })
    public ResponseEntity<CommonResponse<ImportSummary>> incrementalAppend(@Valid @RequestBody BulkImportRequest request) {
        log.info("POST /api/v1/data/import-incremental - records: {}", request.data().size());

        ImportSummary summary = ingestionService.incrementalAppend(request.data());

        return ResponseEntity.ok(CommonResponse.ok(summary, String.format(
                "Incremental import finished: %d inserted, %d errors", summary.insertedCount(), summary.errorCount())));
    }
}
