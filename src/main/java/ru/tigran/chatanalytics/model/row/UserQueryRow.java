package ru.tigran.chatanalytics.model.row;

/**
 * Raw free-text input, consumed by clustering and sentiment analysis.
 */
public record UserQueryRow(String id, String sessionId, String userQuery) {
}
