package ru.tigran.chatanalytics.service.sentiment;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.chatanalytics.dto.SentimentAnalysisResponse;
import ru.tigran.chatanalytics.dto.SentimentAnalysisResponse.ScoredMessage;
import ru.tigran.chatanalytics.dto.SentimentAnalysisResponse.SentimentBucket;
import ru.tigran.chatanalytics.model.AnalyticsFilter;
import ru.tigran.chatanalytics.model.row.UserQueryRow;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SentimentAnalysisService unit тесты")
class SentimentAnalysisServiceTest {

    @Mock
    private SentimentScorer scorer;

    private SentimentAnalysisService service;
    private AnalyticsFilter filter;

    @BeforeEach
    void setUp() {
        service = new SentimentAnalysisService(scorer, 2);
        filter = AnalyticsFilter.of("2024-01-01", "2024-01-31", "pool", "prod", null, null);
    }

    // ===== ГРАНИЦЫ КАТЕГОРИЙ =====

    @Test
    @DisplayName("0.05 -> positive, -0.05 -> negative, 0.0 -> neutral")
    void categoryBoundaries() {
        stub("a", 0.05);
        stub("b", -0.05);
        stub("c", 0.0);

        SentimentAnalysisResponse response = service.analyze(filter, rows("a", "b", "c"));

        List<SentimentBucket> buckets = response.sentimentDistribution();
        assertEquals(List.of("positive", "neutral", "negative"),
                buckets.stream().map(SentimentBucket::category).toList());
        assertEquals(List.of("a"), buckets.get(0).exampleMessages());
        assertEquals(List.of("c"), buckets.get(1).exampleMessages());
        assertEquals(List.of("b"), buckets.get(2).exampleMessages());
        assertEquals(33.33, buckets.get(0).percentage());
        assertEquals(0.0, response.avgSentimentScore());
    }

    @Test
    @DisplayName("Значения чуть внутри границ -> neutral")
    void justInsideBoundaries() {
        assertEquals(SentimentCategory.NEUTRAL, SentimentCategory.fromCompound(0.0499));
        assertEquals(SentimentCategory.NEUTRAL, SentimentCategory.fromCompound(-0.0499));
        assertEquals(SentimentCategory.POSITIVE, SentimentCategory.fromCompound(1.0));
        assertEquals(SentimentCategory.NEGATIVE, SentimentCategory.fromCompound(-1.0));
    }

    // ===== ЭКСТРЕМУМЫ И СРЕДНЕЕ =====

    @Test
    @DisplayName("Самые позитивные и негативные сообщения, не более N, ничьи в порядке входа")
    void extremes() {
        stub("love it", 0.8);
        stub("fine", 0.3);
        stub("also fine", 0.3);
        stub("broken", -0.6);

        SentimentAnalysisResponse response = service.analyze(filter, rows("fine", "love it", "also fine", "broken"));

        assertEquals(4, response.totalMessages());
        assertEquals(List.of(new ScoredMessage("love it", 0.8), new ScoredMessage("fine", 0.3)),
                response.mostPositiveMessages());
        assertEquals(List.of(new ScoredMessage("broken", -0.6), new ScoredMessage("fine", 0.3)),
                response.mostNegativeMessages());
        assertEquals(0.2, response.avgSentimentScore());
        // лимит примеров на категорию
        assertEquals(List.of("fine", "love it"), response.sentimentDistribution().get(0).exampleMessages());
        assertEquals(3, response.sentimentDistribution().get(0).count());
    }

    @Test
    @DisplayName("Среднее и оценки округляются до 3 знаков")
    void roundsScores() {
        stub("x", 0.12345);
        stub("y", 0.45678);

        SentimentAnalysisResponse response = service.analyze(filter, rows("x", "y"));

        assertEquals(0.29, response.avgSentimentScore());
        assertEquals(0.457, response.mostPositiveMessages().get(0).score());
    }

    // ===== ПУСТОЙ ВВОД =====

    @Test
    @DisplayName("Пустая строка -> нейтрально без вызова скорера")
    void blankMessageNotScored() {
        SentimentAnalysisResponse response = service.analyze(filter, rows("", "   "));

        assertEquals(2, response.totalMessages());
        assertEquals(2, response.sentimentDistribution().get(1).count());
        verify(scorer, never()).score(anyString());
    }

    @Test
    @DisplayName("Нет сообщений -> три нулевые категории и пустые экстремумы")
    void noMessages() {
        SentimentAnalysisResponse response = service.analyze(filter, List.of());

        assertEquals(0, response.totalMessages());
        assertEquals(0.0, response.avgSentimentScore());
        assertEquals(3, response.sentimentDistribution().size());
        response.sentimentDistribution().forEach(bucket -> assertEquals(0.0, bucket.percentage()));
        assertTrue(response.mostPositiveMessages().isEmpty());
        assertTrue(response.mostNegativeMessages().isEmpty());
        assertEquals("prod", response.filtersApplied().environment());
    }

    private void stub(String text, double compound) {
        when(scorer.score(text)).thenReturn(new SentimentScore(0.0, 1.0, 0.0, compound));
    }

    private static List<UserQueryRow> rows(String... texts) {
        return java.util.Arrays.stream(texts)
                .map(text -> new UserQueryRow(text + "-id", "s1", text))
                .toList();
    }
}
