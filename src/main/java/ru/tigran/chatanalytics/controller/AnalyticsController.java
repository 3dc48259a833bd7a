package ru.tigran.chatanalytics.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.chatanalytics.dto.ConversationLengthResponse;
import ru.tigran.chatanalytics.dto.PainPointClusteringResponse;
import ru.tigran.chatanalytics.dto.PlatformAnalyticsResponse;
import ru.tigran.chatanalytics.dto.QueryCategoriesResponse;
import ru.tigran.chatanalytics.dto.ReturningUserBehaviorResponse;
import ru.tigran.chatanalytics.dto.SentimentAnalysisResponse;
import ru.tigran.chatanalytics.dto.SessionMetricsResponse;
import ru.tigran.chatanalytics.dto.TimePatternsResponse;
import ru.tigran.chatanalytics.dto.UserEngagementResponse;
import ru.tigran.chatanalytics.dto.UserRetentionResponse;
import ru.tigran.chatanalytics.dto.UserSegmentationResponse;
import ru.tigran.chatanalytics.dto.VolumeTrendsResponse;
import ru.tigran.chatanalytics.exception.ErrorResponse;
import ru.tigran.chatanalytics.model.AnalyticsFilter;
import ru.tigran.chatanalytics.service.AnalyticsService;

/**
 * REST API для KPI аналитики чат-ассистентов.
 * Все эндпоинты принимают одинаковый набор фильтров и требуют bearer token.
 *
 * Фильтры:
 * - start_date, end_date: ISO 8601 дата или дата-время, диапазон включительный
 * - product_context: pool | landscape
 * - environment, user_id: необязательное точное совпадение
 * - user_type: all (по умолчанию) | internal | external
 */
@RestController
@RequestMapping("/api/v1/analytics")
@Tag(name = "Analytics", description = "KPI по журналам взаимодействий")
@SecurityRequirement(name = "bearer-jwt")
@ApiResponses(value = {
        @ApiResponse(
                responseCode = "400",
                description = "Неверные фильтры (дата, product_context, user_type или диапазон дат)",
                content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
                responseCode = "401",
                description = "Отсутствует или невалиден bearer token",
                content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
                responseCode = "500",
                description = "Ошибка выполнения запроса к хранилищу",
                content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
})
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/session-metrics")
    @Operation(summary = "Метрики сессий", description = "Количество сессий, сессии с негативным и позитивным фидбеком, среднее время ответа")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = SessionMetricsResponse.class)))
    public ResponseEntity<SessionMetricsResponse> sessionMetrics(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.sessionMetrics(filter));
    }

    @GetMapping("/pain-point-clustering")
    @Operation(summary = "Кластеризация болевых точек", description = "Классифицирует запросы пользователей по 5 фиксированным кластерам через LLM")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = PainPointClusteringResponse.class)))
    public ResponseEntity<PainPointClusteringResponse> painPointClustering(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.painPointClustering(filter));
    }

    @GetMapping("/volume-trends")
    @Operation(summary = "Тренды объема", description = "Сессии по дням, среднее, пиковый и минимальный день")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = VolumeTrendsResponse.class)))
    public ResponseEntity<VolumeTrendsResponse> volumeTrends(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.volumeTrends(filter));
    }

    @GetMapping("/user-engagement")
    @Operation(summary = "Вовлеченность", description = "Уникальные пользователи, диалоги и среднее число диалогов на пользователя")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = UserEngagementResponse.class)))
    public ResponseEntity<UserEngagementResponse> userEngagement(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.userEngagement(filter));
    }

    @GetMapping("/user-retention")
    @Operation(summary = "Удержание", description = "Доля вернувшихся и разовых пользователей")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = UserRetentionResponse.class)))
    public ResponseEntity<UserRetentionResponse> userRetention(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.userRetention(filter));
    }

    @GetMapping("/query-categories")
    @Operation(summary = "Категории запросов", description = "Распределение сессий по категориям запросов")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = QueryCategoriesResponse.class)))
    public ResponseEntity<QueryCategoriesResponse> queryCategories(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.queryCategories(filter));
    }

    @GetMapping("/returning-user-behavior")
    @Operation(summary = "Поведение вернувшихся пользователей", description = "Сессии на вернувшегося пользователя, самый активный пользователь, период активности")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = ReturningUserBehaviorResponse.class)))
    public ResponseEntity<ReturningUserBehaviorResponse> returningUserBehavior(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.returningUserBehavior(filter));
    }

    @GetMapping("/user-segmentation")
    @Operation(summary = "Сегментация", description = "Пользователи по уровню активности: 1, 2-5, 6+ чатов")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = UserSegmentationResponse.class)))
    public ResponseEntity<UserSegmentationResponse> userSegmentation(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.userSegmentation(filter));
    }

    @GetMapping("/time-patterns")
    @Operation(summary = "Временные паттерны", description = "Распределение сессий по часам и дням недели")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = TimePatternsResponse.class)))
    public ResponseEntity<TimePatternsResponse> timePatterns(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.timePatterns(filter));
    }

    @GetMapping("/conversation-length")
    @Operation(summary = "Длина диалогов", description = "Среднее число сообщений и распределение сессий по длине")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = ConversationLengthResponse.class)))
    public ResponseEntity<ConversationLengthResponse> conversationLength(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.conversationLength(filter));
    }

    @GetMapping("/platform-analytics")
    @Operation(summary = "Платформы", description = "Разбивка по языку, голосовому вводу и мобильному приложению")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = PlatformAnalyticsResponse.class)))
    public ResponseEntity<PlatformAnalyticsResponse> platformAnalytics(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.platformAnalytics(filter));
    }

    @GetMapping("/sentiment-analysis")
    @Operation(summary = "Анализ тональности", description = "Распределение тональности сообщений пользователей")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = SentimentAnalysisResponse.class)))
    public ResponseEntity<SentimentAnalysisResponse> sentimentAnalysis(
            @RequestParam("start_date") String startDate,
            @RequestParam("end_date") String endDate,
            @RequestParam("product_context") String productContext,
            @RequestParam(value = "environment", required = false) String environment,
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "user_type", required = false) String userType
    ) {
        AnalyticsFilter filter = AnalyticsFilter.of(startDate, endDate, productContext, environment, userId, userType);
        return ResponseEntity.ok(analyticsService.sentimentAnalysis(filter));
    }
}
