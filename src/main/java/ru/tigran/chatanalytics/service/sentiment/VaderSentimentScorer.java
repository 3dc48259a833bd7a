package ru.tigran.chatanalytics.service.sentiment;

import com.vader.sentiment.analyzer.SentimentAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

import static ru.tigran.chatanalytics.util.StatsUtils.round;

/**
 * Scores messages with the VADER lexicon and rules.
 *
 * {@link SentimentAnalyzer} keeps the analysed text as instance state,
 * so every call builds its own analyzer.
 */
@Slf4j
@Component
public class VaderSentimentScorer implements SentimentScorer {

    static final String NEGATIVE = "negative";
    static final String NEUTRAL = "neutral";
    static final String POSITIVE = "positive";
    static final String COMPOUND = "compound";

    @Override
    public SentimentScore score(String text) {
        Map<String, Float> polarity;
        try {
            SentimentAnalyzer analyzer = new SentimentAnalyzer(text);
            analyzer.analyze();
            polarity = analyzer.getPolarity();
        } catch (IOException e) {
            // tokenizer failure on one message must not fail the whole batch
            log.warn("Sentiment scoring failed, treating message as neutral: {}", e.getMessage());
            return SentimentScore.NEUTRAL;
        }

        return new SentimentScore(
                component(polarity, NEGATIVE, 3),
                component(polarity, NEUTRAL, 3),
                component(polarity, POSITIVE, 3),
                component(polarity, COMPOUND, 4)
        );
    }

    /**
     * The analyzer reports floats; rounding drops the float-to-double noise
     * so that 0.6249f stays 0.6249.
     */
    private static double component(Map<String, Float> polarity, String key, int scale) {
        Float value = polarity == null ? null : polarity.get(key);
        return value == null ? 0.0 : round(value.doubleValue(), scale);
    }
}
