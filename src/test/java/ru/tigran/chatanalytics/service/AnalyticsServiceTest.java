package ru.tigran.chatanalytics.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import ru.tigran.chatanalytics.dto.PainPointClusteringResponse;
import ru.tigran.chatanalytics.dto.SentimentAnalysisResponse;
import ru.tigran.chatanalytics.dto.SessionMetricsResponse;
import ru.tigran.chatanalytics.dto.UserRetentionResponse;
import ru.tigran.chatanalytics.dto.UserSegmentationResponse;
import ru.tigran.chatanalytics.dto.VolumeTrendsResponse;
import ru.tigran.chatanalytics.exception.ErrorCode;
import ru.tigran.chatanalytics.exception.QueryExecutionException;
import ru.tigran.chatanalytics.model.AnalyticsFilter;
import ru.tigran.chatanalytics.model.row.SessionMetricsRow;
import ru.tigran.chatanalytics.model.row.UserQueryRow;
import ru.tigran.chatanalytics.model.row.UserSessionCountRow;
import ru.tigran.chatanalytics.query.KpiQueries;
import ru.tigran.chatanalytics.query.SqlQuery;
import ru.tigran.chatanalytics.repository.InteractionLogRepository;
import ru.tigran.chatanalytics.service.clustering.PainPointClassifier;
import ru.tigran.chatanalytics.service.clustering.PainPointClusteringService;
import ru.tigran.chatanalytics.service.clustering.PainPointPromptBuilder;
import ru.tigran.chatanalytics.service.clustering.TextClassifier;
import ru.tigran.chatanalytics.service.sentiment.SentimentAnalysisService;
import ru.tigran.chatanalytics.service.sentiment.VaderSentimentScorer;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.DAILY_VOLUME;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.SESSION_METRICS;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.USER_QUERY;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.USER_SESSION_COUNT;

/**
 * Unit-тесты для AnalyticsService.
 * Репозиторий и построитель запросов замоканы, агрегатор настоящий.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AnalyticsService unit тесты")
class AnalyticsServiceTest {

    @Mock
    private KpiQueries queries;

    @Mock
    private InteractionLogRepository repository;

    @Mock
    private PainPointClusteringService clusteringService;

    @Mock
    private SentimentAnalysisService sentimentService;

    private MeterRegistry meterRegistry;
    private AnalyticsService analyticsService;
    private AnalyticsFilter filter;
    private SqlQuery query;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        analyticsService = new AnalyticsService(
                queries, repository, new KpiAggregator(), clusteringService, sentimentService, meterRegistry);
        filter = AnalyticsFilter.of("2024-01-01", "2024-01-31", "pool", null, null, "external");
        query = new SqlQuery("SELECT 1", Map.of());
    }

    // ===== УСПЕШНЫЕ СЦЕНАРИИ =====

    @Test
    @DisplayName("Session metrics: строка агрегата -> ответ и фильтры в эхо")
    void sessionMetrics() {
        when(queries.sessionMetrics(filter)).thenReturn(query);
        when(repository.fetchOne(query, SESSION_METRICS))
                .thenReturn(Optional.of(new SessionMetricsRow(3, 1, 1, 1.5)));

        SessionMetricsResponse response = analyticsService.sessionMetrics(filter);

        assertEquals(3, response.totalSessions());
        assertEquals(1.5, response.avgResponseTime());
        assertEquals("pool", response.filtersApplied().productContext());
        assertEquals("external", response.filtersApplied().userType());
        assertEquals(1.0, meterRegistry.get("analytics.kpi.requests")
                .tags("kpi", "session-metrics", "result", "success").counter().count());
        assertEquals(1, meterRegistry.get("analytics.kpi.latency").tag("kpi", "session-metrics").timer().count());
    }

    @Test
    @DisplayName("Пустое окно -> нулевые формы без исключений")
    void emptyWindowYieldsZeroShapes() {
        when(queries.sessionMetrics(filter)).thenReturn(query);
        when(queries.volumeTrends(filter)).thenReturn(query);
        when(repository.fetchOne(query, SESSION_METRICS)).thenReturn(Optional.empty());
        when(repository.fetchAll(query, DAILY_VOLUME)).thenReturn(List.of());

        SessionMetricsResponse metrics = analyticsService.sessionMetrics(filter);
        VolumeTrendsResponse volume = analyticsService.volumeTrends(filter);

        assertEquals(0, metrics.totalSessions());
        assertEquals(0.0, metrics.avgResponseTime());
        assertEquals(0, volume.totalDays());
        assertEquals(0.0, volume.avgSessionsPerDay());
        assertTrue(volume.dailyData().isEmpty());
    }

    @Test
    @DisplayName("Retention и segmentation используют один и тот же запрос по пользователям")
    void retentionAndSegmentationShareQuery() {
        List<UserSessionCountRow> rows = List.of(
                new UserSessionCountRow("u1", 1),
                new UserSessionCountRow("u2", 3)
        );
        when(queries.userSessionCounts(filter)).thenReturn(query);
        when(repository.fetchAll(query, USER_SESSION_COUNT)).thenReturn(rows);

        UserRetentionResponse retention = analyticsService.userRetention(filter);
        UserSegmentationResponse segmentation = analyticsService.userSegmentation(filter);

        assertEquals(2, retention.totalUsers());
        assertEquals(50.0, retention.returningUsersPercentage());
        assertEquals(2, segmentation.totalUsers());
        verify(queries, times(2)).userSessionCounts(filter);
    }

    @Test
    @DisplayName("Clustering и sentiment получают строки пользовательских запросов")
    void textKpisDelegate() {
        List<UserQueryRow> rows = List.of(new UserQueryRow("1", "s1", "need a pump"));
        PainPointClusteringResponse clustering = new PainPointClusteringResponse(1, List.of(), null);
        SentimentAnalysisResponse sentiment = new SentimentAnalysisResponse(1, 0.0, List.of(), List.of(), List.of(), null);
        when(queries.userQueries(filter)).thenReturn(query);
        when(repository.fetchAll(query, USER_QUERY)).thenReturn(rows);
        when(clusteringService.cluster(filter, rows)).thenReturn(clustering);
        when(sentimentService.analyze(filter, rows)).thenReturn(sentiment);

        assertSame(clustering, analyticsService.painPointClustering(filter));
        assertSame(sentiment, analyticsService.sentimentAnalysis(filter));
    }

    @Test
    @DisplayName("Повторный вызов KPI на тех же данных дает равный ответ")
    void repeatedCallsAreIdempotent() {
        List<UserQueryRow> rows = List.of(
                new UserQueryRow("1", "s1", "which pump fits a 20k gallon pool?"),
                new UserQueryRow("2", "s1", "filter arrived broken :("),
                new UserQueryRow("3", "s2", "thanks, very helpful"),
                new UserQueryRow("4", "s3", "which pump fits a 20k gallon pool?")
        );
        TextClassifier stubClassifier = prompt -> prompt.contains("Query to classify: \"which pump") ? "1" : "4";
        AnalyticsService service = new AnalyticsService(
                queries,
                repository,
                new KpiAggregator(),
                new PainPointClusteringService(
                        new PainPointClassifier(stubClassifier, new PainPointPromptBuilder(), meterRegistry), 5),
                new SentimentAnalysisService(new VaderSentimentScorer(), 5),
                meterRegistry
        );
        when(queries.userQueries(filter)).thenReturn(query);
        when(queries.userSessionCounts(filter)).thenReturn(query);
        when(repository.fetchAll(query, USER_QUERY)).thenReturn(rows);
        when(repository.fetchAll(query, USER_SESSION_COUNT))
                .thenReturn(List.of(new UserSessionCountRow("u1", 1), new UserSessionCountRow("u2", 2)));

        PainPointClusteringResponse firstClustering = service.painPointClustering(filter);
        SentimentAnalysisResponse firstSentiment = service.sentimentAnalysis(filter);
        UserRetentionResponse firstRetention = service.userRetention(filter);

        assertEquals(firstClustering, service.painPointClustering(filter));
        assertEquals(firstSentiment, service.sentimentAnalysis(filter));
        assertEquals(firstRetention, service.userRetention(filter));
        assertEquals(4, firstClustering.totalQueries());
        assertEquals(2.0, meterRegistry.get("analytics.kpi.requests")
                .tags("kpi", "pain-point-clustering", "result", "success").counter().count());
    }

    // ===== ОШИБКИ =====

    @Test
    @DisplayName("Сбой хранилища пробрасывается, счетчик ошибок увеличивается")
    void queryFailurePropagates() {
        QueryExecutionException failure = new QueryExecutionException(
                "Analytics query failed",
                ErrorCode.QUERY_EXECUTION_FAILED.getCode(),
                new DataAccessResourceFailureException("connection refused")
        );
        when(queries.volumeTrends(filter)).thenReturn(query);
        when(repository.fetchAll(eq(query), any())).thenThrow(failure);

        QueryExecutionException ex = assertThrows(QueryExecutionException.class,
                () -> analyticsService.volumeTrends(filter));

        assertSame(failure, ex);
        assertEquals(1.0, meterRegistry.get("analytics.kpi.requests")
                .tags("kpi", "volume-trends", "result", "failure").counter().count());
        assertNull(meterRegistry.find("analytics.kpi.requests")
                .tags("kpi", "volume-trends", "result", "success").counter());
    }
}
