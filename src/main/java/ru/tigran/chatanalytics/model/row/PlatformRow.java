package ru.tigran.chatanalytics.model.row;

/**
 * One (language, voice, mobile) combination with its distinct session and user counts.
 *
 * @param chatLanguage language code as stored, may be null
 */
public record PlatformRow(
        String chatLanguage,
        boolean voiceInput,
        boolean mobileApp,
        long sessionCount,
        long userCount
) {
}
