package ru.tigran.chatanalytics.model.row;

/**
 * @param hourOfDay 0-23
 * @param dayOfWeek 0 = Sunday ... 6 = Saturday
 */
public record TimeSlotRow(int hourOfDay, int dayOfWeek, long sessionCount) {
}
