package ru.tigran.chatanalytics.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Контроллер для информации о сервисе и эндпоинтах
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "Информация об API и доступных эндпоинтах")
public class ApiInfoController {

    private static final String ANALYTICS_PREFIX = "/api/v1/analytics";

    private final String version;

    public ApiInfoController(@Value("${app.version:1.0.0}") String version) {
        this.version = version;
    }

    @GetMapping("/info")
    public ResponseEntity<ApiInfoResponse> getInfo() {
        return ResponseEntity.ok(new ApiInfoResponse(
                "Chat Analytics Engine API",
                "Read-only KPI по журналам взаимодействий чат-ассистентов",
                version,
                "running",
                List.of(
                    new EndpointGroup(
                            "Аналитика",
                            "KPI с фильтрами start_date, end_date, product_context, environment, user_id, user_type",
                            List.of(
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/session-metrics", "Метрики сессий", true),
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/pain-point-clustering", "Кластеризация болевых точек", true),
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/volume-trends", "Тренды объема по дням", true),
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/user-engagement", "Вовлеченность пользователей", true),
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/user-retention", "Удержание пользователей", true),
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/query-categories", "Категории запросов", true),
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/returning-user-behavior", "Поведение вернувшихся пользователей", true),
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/user-segmentation", "Сегментация по активности", true),
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/time-patterns", "Распределение по часам и дням недели", true),
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/conversation-length", "Длина диалогов", true),
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/platform-analytics", "Язык, голосовой ввод, мобильное приложение", true),
                                    new ApiEndpoint("GET", ANALYTICS_PREFIX + "/sentiment-analysis", "Анализ тональности сообщений", true)
                            )
                    ),
                    new EndpointGroup(
                            "Сервис",
                            "Состояние и документация",
                            List.of(
                                    new ApiEndpoint("GET", "/actuator/health", "Состояние БД и классификатора", false),
                                    new ApiEndpoint("GET", "/swagger-ui.html", "Интерактивная документация Swagger UI", false),
                                    new ApiEndpoint("GET", "/v3/api-docs", "OpenAPI документация в JSON формате", false),
                                    new ApiEndpoint("GET", "/api/info", "Информация о сервисе", false)
                            )
                    )
                )
        ));
    }

    public record ApiInfoResponse(
            String title,
            String description,
            String version,
            String status,
            List<EndpointGroup> groups
    ) {
    }

    public record EndpointGroup(String name, String description, List<ApiEndpoint> endpoints) {
    }

    public record ApiEndpoint(String method, String path, String description, boolean requiresAuth) {
    }
}
