package ru.tigran.chatanalytics.dto;

import java.util.List;

/**
 * KPI #12: Sentiment Analysis.
 *
 * Example:
 * {
 *   "total_messages": 3,
 *   "avg_sentiment_score": 0.214,
 *   "sentiment_distribution": [
 *     {"category": "positive", "count": 1, "percentage": 33.33, "example_messages": ["thanks, great help"]},
 *     ...
 *   ],
 *   "most_positive_messages": [{"message": "thanks, great help", "score": 0.869}],
 *   "most_negative_messages": [{"message": "this is useless", "score": -0.421}]
 * }
 */
public record SentimentAnalysisResponse(
        long totalMessages,
        double avgSentimentScore,
        List<SentimentBucket> sentimentDistribution,
        List<ScoredMessage> mostPositiveMessages,
        List<ScoredMessage> mostNegativeMessages,
        FiltersApplied filtersApplied
) {

    public record SentimentBucket(String category, long count, double percentage, List<String> exampleMessages) {
    }

    public record ScoredMessage(String message, double score) {
    }
}
