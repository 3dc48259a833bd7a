package ru.tigran.chatanalytics.service.sentiment;

/**
 * Sentiment buckets, declared in the order they are reported.
 */
public enum SentimentCategory {
    POSITIVE("positive"),
    NEUTRAL("neutral"),
    NEGATIVE("negative");

    static final double POSITIVE_THRESHOLD = 0.05;
    static final double NEGATIVE_THRESHOLD = -0.05;

    private final String value;

    SentimentCategory(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * compound >= 0.05 is positive, compound <= -0.05 is negative, anything between is neutral.
     */
    public static SentimentCategory fromCompound(double compound) {
        if (compound >= POSITIVE_THRESHOLD) {
            return POSITIVE;
        }
        if (compound <= NEGATIVE_THRESHOLD) {
            return NEGATIVE;
        }
        return NEUTRAL;
    }
}
