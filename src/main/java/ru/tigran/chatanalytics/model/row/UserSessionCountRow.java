package ru.tigran.chatanalytics.model.row;

/**
 * Distinct session count of one user. Shared by retention and segmentation.
 */
public record UserSessionCountRow(String userId, long sessionCount) {
}
