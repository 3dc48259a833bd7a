package ru.tigran.chatanalytics.service.clustering;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.tigran.chatanalytics.dto.FiltersApplied;
import ru.tigran.chatanalytics.dto.PainPointClusteringResponse;
import ru.tigran.chatanalytics.dto.PainPointClusteringResponse.ClusterSummary;
import ru.tigran.chatanalytics.model.AnalyticsFilter;
import ru.tigran.chatanalytics.model.row.UserQueryRow;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static ru.tigran.chatanalytics.util.StatsUtils.percentage;

/**
 * KPI #2: classifies the user queries of a filter window and tallies them per cluster.
 */
@Service
public class PainPointClusteringService {

    private final PainPointClassifier classifier;
    private final int maxExamplesPerCluster;

    public PainPointClusteringService(
            PainPointClassifier classifier,
            @Value("${app.clustering.max-examples-per-cluster:5}") int maxExamplesPerCluster
    ) {
        this.classifier = classifier;
        this.maxExamplesPerCluster = maxExamplesPerCluster;
    }

    public PainPointClusteringResponse cluster(AnalyticsFilter filter, List<UserQueryRow> rows) {
        List<String> queries = rows.stream().map(UserQueryRow::userQuery).toList();
        List<PainPointCluster> assignments = queries.isEmpty() ? List.of() : classifier.classifyAll(queries);

        Map<PainPointCluster, Long> counts = new EnumMap<>(PainPointCluster.class);
        Map<PainPointCluster, List<String>> examples = new EnumMap<>(PainPointCluster.class);
        for (PainPointCluster cluster : PainPointCluster.values()) {
            counts.put(cluster, 0L);
            examples.put(cluster, new ArrayList<>());
        }

        for (int i = 0; i < queries.size(); i++) {
            PainPointCluster cluster = assignments.get(i);
            counts.merge(cluster, 1L, Long::sum);
            List<String> clusterExamples = examples.get(cluster);
            if (clusterExamples.size() < maxExamplesPerCluster) {
                clusterExamples.add(queries.get(i));
            }
        }

        long total = queries.size();
        List<ClusterSummary> clusters = new ArrayList<>();
        for (PainPointCluster cluster : PainPointCluster.values()) {
            long count = counts.get(cluster);
            clusters.add(new ClusterSummary(
                    cluster.getId(),
                    cluster.getDisplayName(),
                    count,
                    percentage(count, total),
                    examples.get(cluster)
            ));
        }

        return new PainPointClusteringResponse(total, clusters, FiltersApplied.from(filter));
    }
}
