package ru.tigran.chatanalytics.model.row;

public record EngagementRow(long uniqueUsers, long totalConversations) {
}
