package ru.tigran.chatanalytics.model.row;

public record SessionLengthRow(String sessionId, long messageCount) {
}
