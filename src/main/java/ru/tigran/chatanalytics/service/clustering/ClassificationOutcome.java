package ru.tigran.chatanalytics.service.clustering;

import java.util.Objects;

/**
 * Result of classifying one query: either the cluster the classifier chose,
 * or the reason it could not be used.
 */
public record ClassificationOutcome(PainPointCluster cluster, FailureReason failure) {

    public enum FailureReason {
        /** Transient outage: open circuit, throttling, gateway errors, I/O failures. */
        SERVICE_UNAVAILABLE,
        /** Non-retriable failure of the classifier call: missing key, rejected request, malformed envelope. */
        SERVICE_ERROR,
        /** The response contained no decimal digit. */
        NO_DIGIT,
        /** The first digit of the response is not a known cluster id. */
        OUT_OF_RANGE
    }

    public ClassificationOutcome {
        if ((cluster == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of cluster and failure must be set");
        }
    }

    public static ClassificationOutcome success(PainPointCluster cluster) {
        return new ClassificationOutcome(Objects.requireNonNull(cluster), null);
    }

    public static ClassificationOutcome failure(FailureReason reason) {
        return new ClassificationOutcome(null, Objects.requireNonNull(reason));
    }

    public boolean isSuccess() {
        return cluster != null;
    }

    /**
     * Scans the response left to right for the first decimal digit and maps it to a cluster.
     */
    public static ClassificationOutcome parse(String response) {
        if (response == null) {
            return failure(FailureReason.NO_DIGIT);
        }
        for (int i = 0; i < response.length(); i++) {
            char c = response.charAt(i);
            if (c >= '0' && c <= '9') {
                return PainPointCluster.fromId(c - '0')
                        .map(ClassificationOutcome::success)
                        .orElseGet(() -> failure(FailureReason.OUT_OF_RANGE));
            }
        }
        return failure(FailureReason.NO_DIGIT);
    }
}
