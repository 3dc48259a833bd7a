package ru.tigran.chatanalytics.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and ratio helpers shared by all KPI aggregators.
 * An empty denominator always yields 0.0, never NaN or an exception.
 */
public final class StatsUtils {

    private StatsUtils() {
    }

    /**
     * Percentage of part in total, rounded to 2 decimals.
     */
    public static double percentage(long part, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return round(part * 100.0 / total, 2);
    }

    /**
     * Mean rounded to 2 decimals.
     */
    public static double average(double sum, long count) {
        if (count <= 0) {
            return 0.0;
        }
        return round(sum / count, 2);
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
