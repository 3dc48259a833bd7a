package ru.tigran.chatanalytics.service.sentiment;

/**
 * Synchronous, local sentiment scorer. Never called with blank text.
 */
public interface SentimentScorer {

    SentimentScore score(String text);
}
