package ru.tigran.chatanalytics.service.clustering;

import org.springframework.stereotype.Component;

/**
 * Builds the classification prompt: the same fixed few-shot preamble for every query,
 * followed by the query itself.
 */
@Component
public class PainPointPromptBuilder {

    private final String preamble;

    public PainPointPromptBuilder() {
        this.preamble = buildPreamble();
    }

    public String build(String query) {
        return preamble
                + "\n\nQuery to classify: \"" + query + "\""
                + "\n\nCluster number:";
    }

    String preamble() {
        return preamble;
    }

    private static String buildPreamble() {
        StringBuilder sb = new StringBuilder();
        sb.append("You are classifying customer queries for a pool and landscape supply company into ")
                .append(PainPointCluster.values().length)
                .append(" categories.\n\n")
                .append("Categories and Examples:\n");

        for (PainPointCluster cluster : PainPointCluster.values()) {
            sb.append("\nCluster ").append(cluster.getId()).append(": ").append(cluster.getDescription()).append('\n');
            sb.append("Examples:\n");
            for (String example : cluster.getExamples()) {
                sb.append("- \"").append(example).append("\"\n");
            }
        }

        sb.append("\nRespond ONLY with the cluster number (0-4). Do not use thinking tags. Just output the number.");
        return sb.toString();
    }
}
