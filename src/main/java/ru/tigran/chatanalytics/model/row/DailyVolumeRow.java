package ru.tigran.chatanalytics.model.row;

import java.time.LocalDate;

public record DailyVolumeRow(LocalDate date, long sessionCount) {
}
