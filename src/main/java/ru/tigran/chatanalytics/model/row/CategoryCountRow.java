package ru.tigran.chatanalytics.model.row;

/**
 * @param queryCategory category label as stored, may be null
 */
public record CategoryCountRow(String queryCategory, long sessionCount) {
}
