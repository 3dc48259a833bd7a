package ru.tigran.chatanalytics.model.row;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Per-user activity window used by the returning-user behavior KPI.
 */
public record ReturningUserRow(
        String userId,
        long sessionCount,
        LocalDate firstChatDate,
        LocalDate lastChatDate
) {

    /**
     * Whole days between the first and last chat date, 0 when either is unknown.
     */
    public long activeDays() {
        if (firstChatDate == null || lastChatDate == null) {
            return 0;
        }
        return ChronoUnit.DAYS.between(firstChatDate, lastChatDate);
    }
}
