package ru.tigran.chatanalytics.service.sentiment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.tigran.chatanalytics.dto.FiltersApplied;
import ru.tigran.chatanalytics.dto.SentimentAnalysisResponse;
import ru.tigran.chatanalytics.dto.SentimentAnalysisResponse.ScoredMessage;
import ru.tigran.chatanalytics.dto.SentimentAnalysisResponse.SentimentBucket;
import ru.tigran.chatanalytics.model.AnalyticsFilter;
import ru.tigran.chatanalytics.model.row.UserQueryRow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static ru.tigran.chatanalytics.util.StatsUtils.percentage;
import static ru.tigran.chatanalytics.util.StatsUtils.round;

/**
 * KPI #12: scores every user message and summarises the batch.
 */
@Slf4j
@Service
public class SentimentAnalysisService {

    private final SentimentScorer scorer;
    private final int maxExamples;

    public SentimentAnalysisService(
            SentimentScorer scorer,
            @Value("${app.sentiment.max-examples:5}") int maxExamples
    ) {
        this.scorer = scorer;
        this.maxExamples = maxExamples;
    }

    public SentimentAnalysisResponse analyze(AnalyticsFilter filter, List<UserQueryRow> rows) {
        List<String> messages = rows.stream().map(UserQueryRow::userQuery).toList();
        List<ScoredMessage> scored = new ArrayList<>(messages.size());

        Map<SentimentCategory, Long> counts = new EnumMap<>(SentimentCategory.class);
        Map<SentimentCategory, List<String>> examples = new EnumMap<>(SentimentCategory.class);
        for (SentimentCategory category : SentimentCategory.values()) {
            counts.put(category, 0L);
            examples.put(category, new ArrayList<>());
        }

        double compoundSum = 0.0;
        for (String message : messages) {
            double compound = scoreOf(message).compound();
            compoundSum += compound;

            SentimentCategory category = SentimentCategory.fromCompound(compound);
            counts.merge(category, 1L, Long::sum);
            List<String> categoryExamples = examples.get(category);
            if (categoryExamples.size() < maxExamples) {
                categoryExamples.add(message);
            }
            scored.add(new ScoredMessage(message, compound));
        }

        long total = messages.size();
        List<SentimentBucket> distribution = new ArrayList<>();
        for (SentimentCategory category : SentimentCategory.values()) {
            long count = counts.get(category);
            distribution.add(new SentimentBucket(
                    category.getValue(), count, percentage(count, total), examples.get(category)));
        }

        // List.sort is stable: equal scores keep input order
        List<ScoredMessage> descending = new ArrayList<>(scored);
        descending.sort(Comparator.comparingDouble(ScoredMessage::score).reversed());
        List<ScoredMessage> ascending = new ArrayList<>(scored);
        ascending.sort(Comparator.comparingDouble(ScoredMessage::score));

        double average = total == 0 ? 0.0 : round(compoundSum / total, 3);
        log.debug("Scored {} messages, average compound {}", total, average);

        return new SentimentAnalysisResponse(
                total,
                average,
                distribution,
                top(descending),
                top(ascending),
                FiltersApplied.from(filter)
        );
    }

    SentimentScore scoreOf(String message) {
        if (message == null || message.isBlank()) {
            return SentimentScore.NEUTRAL;
        }
        return scorer.score(message);
    }

    private List<ScoredMessage> top(List<ScoredMessage> sorted) {
        return sorted.stream()
                .limit(maxExamples)
                .map(m -> new ScoredMessage(m.message(), round(m.score(), 3)))
                .toList();
    }
}
