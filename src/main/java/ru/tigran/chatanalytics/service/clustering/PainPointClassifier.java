package ru.tigran.chatanalytics.service.clustering;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.chatanalytics.exception.ApplicationException;
import ru.tigran.chatanalytics.service.clustering.ClassificationOutcome.FailureReason;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns every query of a batch to exactly one pain-point cluster.
 *
 * The output is one-to-one and order-preserving with the input. Blank queries go to the
 * fallback cluster without a call; each distinct non-blank text is sent to the classifier once
 * and its outcome reused for repeats. Failed outcomes are mapped to the fallback cluster in
 * {@link #resolve}, so one bad item never aborts the batch.
 */
@Slf4j
@Component
public class PainPointClassifier {

    private final TextClassifier textClassifier;
    private final PainPointPromptBuilder promptBuilder;
    private final Counter successfulCalls;
    private final Counter failedCalls;
    private final Map<FailureReason, Counter> fallbackCounters = new EnumMap<>(FailureReason.class);

    public PainPointClassifier(
            TextClassifier textClassifier,
            PainPointPromptBuilder promptBuilder,
            MeterRegistry meterRegistry
    ) {
        this.textClassifier = textClassifier;
        this.promptBuilder = promptBuilder;
        this.successfulCalls = Counter.builder("analytics.classifier.calls")
                .description("Classifier calls")
                .tag("result", "success")
                .register(meterRegistry);
        this.failedCalls = Counter.builder("analytics.classifier.calls")
                .description("Classifier calls")
                .tag("result", "failure")
                .register(meterRegistry);
        for (FailureReason reason : FailureReason.values()) {
            fallbackCounters.put(reason, Counter.builder("analytics.classifier.fallbacks")
                    .description("Queries assigned to the fallback cluster after a failed classification")
                    .tag("reason", reason.name())
                    .register(meterRegistry));
        }
    }

    public List<PainPointCluster> classifyAll(List<String> queries) {
        Map<String, PainPointCluster> resolved = new HashMap<>();
        List<PainPointCluster> result = new ArrayList<>(queries.size());

        for (String query : queries) {
            if (query == null || query.isBlank()) {
                result.add(PainPointCluster.FALLBACK);
                continue;
            }
            result.add(resolved.computeIfAbsent(query, text -> resolve(classify(text))));
        }

        log.debug("Classified {} queries with {} classifier calls", queries.size(), resolved.size());
        return result;
    }

    /**
     * Classifies a single non-blank query without applying the fallback.
     */
    public ClassificationOutcome classify(String query) {
        String response;
        try {
            response = textClassifier.generate(promptBuilder.build(query));
        } catch (RuntimeException e) {
            failedCalls.increment();
            boolean retriable = e instanceof ApplicationException && ((ApplicationException) e).isRetriable();
            log.warn("Classifier call failed (retriable={}), using fallback cluster: {}", retriable, e.getMessage());
            return ClassificationOutcome.failure(retriable ? FailureReason.SERVICE_UNAVAILABLE : FailureReason.SERVICE_ERROR);
        }
        successfulCalls.increment();

        ClassificationOutcome outcome = ClassificationOutcome.parse(response);
        if (!outcome.isSuccess()) {
            log.warn("Unusable classifier answer ({}), using fallback cluster", outcome.failure());
        }
        return outcome;
    }

    private PainPointCluster resolve(ClassificationOutcome outcome) {
        if (outcome.isSuccess()) {
            return outcome.cluster();
        }
        fallbackCounters.get(outcome.failure()).increment();
        return PainPointCluster.FALLBACK;
    }
}
