package ru.tigran.employeeinsights.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Контроллер для информации об API и эндпоинтах
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "Информация об API и доступных эндпоинтах")
public class ApiInfoController {

    @GetMapping("/endpoints")
    public ResponseEntity<ApiEndpointsResponse> getEndpoints() {
        return ResponseEntity.ok(new ApiEndpointsResponse(
                "Employee Insights Engine API",
                "Загрузка отзывов сотрудников и агрегаты тональности по ключевым словам и городам",
                "1.0.0",
                List.of(
                    new EndpointGroup(
                            "Аутентификация",
                            "Вход пользователей дашборда",
                            List.of(
                                    new ApiEndpoint("POST", "/api/v1/auth/login", "Вход в систему и получение JWT токена", false),
                                    new ApiEndpoint("GET", "/api/v1/auth/validate", "Проверить JWT токен", true)
                            )
                    ),
                    new EndpointGroup(
                            "Импорт данных",
                            "Загрузка записей и пересчет агрегатов (ADMIN)",
                            List.of(
                                    new ApiEndpoint("POST", "/api/v1/data/import", "Полная перезагрузка данных", true),
                                    new ApiEndpoint("POST", "/api/v1/data/import-incremental", "Добавить записи", true),
                                    new ApiEndpoint("POST", "/api/v1/insights/summary/refresh", "Пересчитать агрегат по ключевым словам", true),
                                    new ApiEndpoint("POST", "/api/v1/kota-summary/refresh", "Пересчитать агрегат по городам", true)
                            )
                    ),
                    new EndpointGroup(
                            "Инсайты",
                            "Агрегаты тональности по ключевым словам",
                            List.of(
                                    new ApiEndpoint("GET", "/api/v1/insights/summary", "Сохраненный агрегат", true),
                                    new ApiEndpoint("GET", "/api/v1/insights/filtered", "Агрегат с фильтрами search, sentiment, dateFrom, dateTo", true),
                                    new ApiEndpoint("GET", "/api/v1/insights/dashboard", "Сводка для дашборда", true),
                                    new ApiEndpoint("GET", "/api/v1/insights/top-positive", "Самые позитивные ключевые слова", true),
                                    new ApiEndpoint("GET", "/api/v1/insights/top-negative", "Самые негативные ключевые слова", true),
                                    new ApiEndpoint("GET", "/api/v1/insights/top-10", "Топ-10 по количеству упоминаний", true),
                                    new ApiEndpoint("GET", "/api/v1/insights/search/{word}", "Поиск по ключевым словам", true),
                                    new ApiEndpoint("GET", "/api/v1/insights/details/{keyword}", "Записи по ключевому слову", true)
                            )
                    ),
                    new EndpointGroup(
                            "Записи и города",
                            "Исходные записи, статистика и агрегаты по городам",
                            List.of(
                                    new ApiEndpoint("GET", "/api/v1/employee-insights/paginated", "Записи постранично", true),
                                    new ApiEndpoint("GET", "/api/v1/employee-insights/stats", "Общая статистика", true),
                                    new ApiEndpoint("GET", "/api/v1/employee-insights/monthly-trends", "Тренды по месяцам", true),
                                    new ApiEndpoint("GET", "/api/v1/kota-summary", "Сводка по городам", true),
                                    new ApiEndpoint("GET", "/api/v1/kota-summary/{kota}", "Сводка по одному городу", true)
                            )
                    ),
                    new EndpointGroup(
                            "Закладки и выводы",
                            "Закладки на ключевые слова и AI вывод",
                            List.of(
                                    new ApiEndpoint("GET", "/api/v1/bookmarks", "Все закладки", true),
                                    new ApiEndpoint("POST", "/api/v1/bookmarks", "Добавить закладку", true),
                                    new ApiEndpoint("DELETE", "/api/v1/bookmarks/{id}", "Удалить закладку", true),
                                    new ApiEndpoint("DELETE", "/api/v1/bookmarks/insight/{insightId}/{insightTitle}", "Удалить закладку по инсайту", true),
                                    new ApiEndpoint("POST", "/api/v1/ai-conclusion/generate", "Сгенерировать AI вывод", true)
                            )
                    ),
                    new EndpointGroup(
                            "Документация",
                            "Доступ к документации API",
                            List.of(
                                    new ApiEndpoint("GET", "/swagger-ui.html", "Интерактивная документация Swagger UI", false),
                                    new ApiEndpoint("GET", "/v3/api-docs", "OpenAPI документация в JSON формате", false),
                                    new ApiEndpoint("GET", "/api/endpoints", "Получить список всех эндпоинтов", false)
                            )
                    )
                )
        ));
    }

    public record ApiEndpointsResponse(String title, String description, String version, List<EndpointGroup> groups) {
    }

    public record EndpointGroup(String name, String description, List<ApiEndpoint> endpoints) {
    }

    public record ApiEndpoint(String method, String path, String description, boolean requiresAuth) {
    }
}
