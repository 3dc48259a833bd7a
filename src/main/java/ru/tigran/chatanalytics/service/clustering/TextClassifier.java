package ru.tigran.chatanalytics.service.clustering;

/**
 * External text-generation service used to classify queries.
 * Implementations may throw on transport or service failure; callers do not retry.
 */
public interface TextClassifier {

    String generate(String prompt);
}
