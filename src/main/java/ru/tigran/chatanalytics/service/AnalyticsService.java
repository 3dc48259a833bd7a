package ru.tigran.chatanalytics.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
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
import ru.tigran.chatanalytics.model.AnalyticsFilter;
import ru.tigran.chatanalytics.model.row.UserQueryRow;
import ru.tigran.chatanalytics.query.KpiQueries;
import ru.tigran.chatanalytics.repository.InteractionLogRepository;
import ru.tigran.chatanalytics.service.clustering.PainPointClusteringService;
import ru.tigran.chatanalytics.service.sentiment.SentimentAnalysisService;

import java.util.List;
import java.util.function.Supplier;

import static ru.tigran.chatanalytics.repository.KpiRowMappers.CATEGORY_COUNT;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.DAILY_VOLUME;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.ENGAGEMENT;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.PLATFORM;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.RETURNING_USER;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.SESSION_LENGTH;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.SESSION_METRICS;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.TIME_SLOT;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.USER_QUERY;
import static ru.tigran.chatanalytics.repository.KpiRowMappers.USER_SESSION_COUNT;

/**
 * Entry point for every KPI: build the query, run it, aggregate the rows.
 *
 * Stateless between calls; concurrent requests share nothing but the connection pool
 * and recompute independently.
 */
@Slf4j
@Service
public class AnalyticsService {

    private final KpiQueries queries;
    private final InteractionLogRepository repository;
    private final KpiAggregator aggregator;
    private final PainPointClusteringService clusteringService;
    private final SentimentAnalysisService sentimentService;
    private final MeterRegistry meterRegistry;

    public AnalyticsService(
            KpiQueries queries,
            InteractionLogRepository repository,
            KpiAggregator aggregator,
            PainPointClusteringService clusteringService,
            SentimentAnalysisService sentimentService,
            MeterRegistry meterRegistry
    ) {
        this.queries = queries;
        this.repository = repository;
        this.aggregator = aggregator;
        this.clusteringService = clusteringService;
        this.sentimentService = sentimentService;
        this.meterRegistry = meterRegistry;
    }

    public SessionMetricsResponse sessionMetrics(AnalyticsFilter filter) {
        return compute("session-metrics", filter, () ->
                aggregator.sessionMetrics(filter, repository.fetchOne(queries.sessionMetrics(filter), SESSION_METRICS)));
    }

    public PainPointClusteringResponse painPointClustering(AnalyticsFilter filter) {
        return compute("pain-point-clustering", filter, () ->
                clusteringService.cluster(filter, userQueries(filter)));
    }

    public VolumeTrendsResponse volumeTrends(AnalyticsFilter filter) {
        return compute("volume-trends", filter, () ->
                aggregator.volumeTrends(filter, repository.fetchAll(queries.volumeTrends(filter), DAILY_VOLUME)));
    }

    public UserEngagementResponse userEngagement(AnalyticsFilter filter) {
        return compute("user-engagement", filter, () ->
                aggregator.userEngagement(filter, repository.fetchOne(queries.userEngagement(filter), ENGAGEMENT)));
    }

    public UserRetentionResponse userRetention(AnalyticsFilter filter) {
        return compute("user-retention", filter, () ->
                aggregator.userRetention(filter,
                        repository.fetchAll(queries.userSessionCounts(filter), USER_SESSION_COUNT)));
    }

    public QueryCategoriesResponse queryCategories(AnalyticsFilter filter) {
        return compute("query-categories", filter, () ->
                aggregator.queryCategories(filter, repository.fetchAll(queries.queryCategories(filter), CATEGORY_COUNT)));
    }

    public ReturningUserBehaviorResponse returningUserBehavior(AnalyticsFilter filter) {
        return compute("returning-user-behavior", filter, () ->
                aggregator.returningUserBehavior(filter,
                        repository.fetchAll(queries.returningUserBehavior(filter), RETURNING_USER)));
    }

    public UserSegmentationResponse userSegmentation(AnalyticsFilter filter) {
        return compute("user-segmentation", filter, () ->
                aggregator.userSegmentation(filter,
                        repository.fetchAll(queries.userSessionCounts(filter), USER_SESSION_COUNT)));
    }

    public TimePatternsResponse timePatterns(AnalyticsFilter filter) {
        return compute("time-patterns", filter, () ->
                aggregator.timePatterns(filter, repository.fetchAll(queries.timePatterns(filter), TIME_SLOT)));
    }

    public ConversationLengthResponse conversationLength(AnalyticsFilter filter) {
        return compute("conversation-length", filter, () ->
                aggregator.conversationLength(filter,
                        repository.fetchAll(queries.conversationLength(filter), SESSION_LENGTH)));
    }

    public PlatformAnalyticsResponse platformAnalytics(AnalyticsFilter filter) {
        return compute("platform-analytics", filter, () ->
                aggregator.platformAnalytics(filter, repository.fetchAll(queries.platformAnalytics(filter), PLATFORM)));
    }

    public SentimentAnalysisResponse sentimentAnalysis(AnalyticsFilter filter) {
        return compute("sentiment-analysis", filter, () ->
                sentimentService.analyze(filter, userQueries(filter)));
    }

    private List<UserQueryRow> userQueries(AnalyticsFilter filter) {
        return repository.fetchAll(queries.userQueries(filter), USER_QUERY);
    }

    private <T> T compute(String kpi, AnalyticsFilter filter, Supplier<T> computation) {
        log.info("Computing {} for context={}, range=[{}, {}], user_type={}",
                kpi, filter.productContext().getValue(), filter.startDate(), filter.endDate(),
                filter.userType().getValue());

        Timer timer = Timer.builder("analytics.kpi.latency")
                .description("KPI computation time")
                .tag("kpi", kpi)
                .register(meterRegistry);

        long startNanos = System.nanoTime();
        try {
            T result = timer.record(computation);
            requestCounter(kpi, "success").increment();
            log.info("Computed {} in {} ms", kpi, (System.nanoTime() - startNanos) / 1_000_000);
            return result;
        } catch (RuntimeException e) {
            requestCounter(kpi, "failure").increment();
            log.warn("Failed to compute {}: {}", kpi, e.getMessage());
            throw e;
        }
    }

    private Counter requestCounter(String kpi, String result) {
        return Counter.builder("analytics.kpi.requests")
                .description("KPI requests by outcome")
                .tag("kpi", kpi)
                .tag("result", result)
                .register(meterRegistry);
    }
}
