package ru.tigran.chatanalytics.service.clustering;

import java.util.List;
import java.util.Optional;

/**
 * Fixed pain-point taxonomy. Ids are the digits the classifier answers with;
 * descriptions and examples form the few-shot preamble of every prompt.
 */
public enum PainPointCluster {
    GENERAL(0,
            "General branch hours / orders / pool questions",
            "General branch hours, order status, locations, general pool/landscape questions",
            List.of(
                    "What are your hours?",
                    "Where is the nearest branch?",
                    "How do I track my order?",
                    "What pool chemicals do you recommend?"
            )),
    PUMP_RECOMMENDATIONS(1,
            "Pump recommendations – product discovery",
            "Pump recommendations and product discovery (customer looking for product suggestions)",
            List.of(
                    "What pumps do you carry?",
                    "I need a variable speed pump recommendation",
                    "Looking for a pentair heat pump",
                    "Best pump for above ground pool?"
            )),
    REPLACEMENT_PARTS(2,
            "Replacement filter parts – maintenance needs",
            "Replacement filter parts and maintenance needs (customer needs specific parts for maintenance)",
            List.of(
                    "I need a hayward skimmer basket",
                    "Replacement grid assembly for filter",
                    "Filter cartridge for C5030",
                    "Need O-rings for my pump"
            )),
    STOCK_AVAILABILITY(3,
            "Stock availability by part number – inventory checks",
            "Stock availability and inventory checks by part number",
            List.of(
                    "Do you have part# 12345 in stock?",
                    "Is the F5B available?",
                    "Do you carry CX580XRE?",
                    "Stock check on hayward SP1091LX"
            )),
    TECHNICAL_SUPPORT(4,
            "DE filter assembly – technical support",
            "DE filter assembly and technical support (technical help, installation, troubleshooting)",
            List.of(
                    "How do I assemble a DE filter?",
                    "My filter is leaking, help?",
                    "Installation guide for grid assembly",
                    "Troubleshoot pump not priming"
            ));

    /** Cluster assigned to empty input and to every classification failure. */
    public static final PainPointCluster FALLBACK = GENERAL;

    private final int id;
    private final String displayName;
    private final String description;
    private final List<String> examples;

    PainPointCluster(int id, String displayName, String description, List<String> examples) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.examples = examples;
    }

    public int getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getExamples() {
        return examples;
    }

    public static Optional<PainPointCluster> fromId(int id) {
        for (PainPointCluster cluster : values()) {
            if (cluster.id == id) {
                return Optional.of(cluster);
            }
        }
        return Optional.empty();
    }
}
