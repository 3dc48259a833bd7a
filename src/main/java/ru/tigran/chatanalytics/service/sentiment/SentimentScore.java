package ru.tigran.chatanalytics.service.sentiment;

/**
 * VADER score of one message. {@code neg}, {@code neu} and {@code pos} are proportions of
 * the text; {@code compound} is the normalised overall polarity in [-1, 1].
 */
public record SentimentScore(double neg, double neu, double pos, double compound) {

    /** Score assigned to empty input. */
    public static final SentimentScore NEUTRAL = new SentimentScore(0.0, 1.0, 0.0, 0.0);
}
