package ru.tigran.chatanalytics.dto;

import java.util.List;

/**
 * KPI #8: User Segmentation. Always three segments: low (1), medium (2-5), high (6+).
 */
public record UserSegmentationResponse(
        long totalUsers,
        List<Segment> segments,
        FiltersApplied filtersApplied
) {

    public record Segment(String segmentName, long userCount, double percentage) {
    }
}
