package ru.tigran.chatanalytics.dto;

import java.util.List;

/**
 * KPI #2: Pain-Point Clustering. All five clusters are always present, in id order.
 */
public record PainPointClusteringResponse(
        long totalQueries,
        List<ClusterSummary> clusters,
        FiltersApplied filtersApplied
) {

    /**
     * @param exampleQueries up to N queries, in the order they were encountered
     */
    public record ClusterSummary(
            int clusterId,
            String clusterName,
            long count,
            double percentage,
            List<String> exampleQueries
    ) {
    }
}
