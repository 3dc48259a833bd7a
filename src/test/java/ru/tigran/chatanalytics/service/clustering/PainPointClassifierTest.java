package ru.tigran.chatanalytics.service.clustering;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.chatanalytics.exception.AIGatewayException;
import ru.tigran.chatanalytics.exception.ErrorCode;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

/**
 * Unit-тесты для PainPointClassifier.
 * Классификатор заменен заглушкой для детерминированности.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PainPointClassifier unit тесты")
class PainPointClassifierTest {

    @Mock
    private TextClassifier textClassifier;

    private MeterRegistry meterRegistry;
    private PainPointClassifier classifier;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        classifier = new PainPointClassifier(textClassifier, new PainPointPromptBuilder(), meterRegistry);
    }

    // ===== УСПЕШНЫЕ СЦЕНАРИИ =====

    @Test
    @DisplayName("Ответ '2 because…' -> кластер 2")
    void firstDigitWins() {
        when(textClassifier.generate(anyString())).thenReturn("2 because the user needs a part");

        List<PainPointCluster> result = classifier.classifyAll(List.of("need a skimmer basket"));

        assertEquals(List.of(PainPointCluster.REPLACEMENT_PARTS), result);
    }

    @Test
    @DisplayName("Текст перед цифрой игнорируется: '<think>…</think> Cluster 3' -> 3")
    void leadingTextIgnored() {
        when(textClassifier.generate(anyString())).thenReturn("<think>stock question</think>\nCluster 3");

        List<PainPointCluster> result = classifier.classifyAll(List.of("is F5B in stock?"));

        assertEquals(List.of(PainPointCluster.STOCK_AVAILABILITY), result);
    }

    @Test
    @DisplayName("Порядок результатов совпадает с порядком входа")
    void preservesOrder() {
        when(textClassifier.generate(contains("Query to classify: \"pump?\""))).thenReturn("1");
        when(textClassifier.generate(contains("Query to classify: \"leak\""))).thenReturn("4");
        when(textClassifier.generate(contains("Query to classify: \"hours\""))).thenReturn("0");

        List<PainPointCluster> result = classifier.classifyAll(List.of("pump?", "leak", "hours"));

        assertEquals(List.of(
                PainPointCluster.PUMP_RECOMMENDATIONS,
                PainPointCluster.TECHNICAL_SUPPORT,
                PainPointCluster.GENERAL
        ), result);
    }

    @Test
    @DisplayName("Повторяющийся текст классифицируется одним вызовом")
    void deduplicatesDistinctTexts() {
        when(textClassifier.generate(anyString())).thenReturn("1");

        List<PainPointCluster> result = classifier.classifyAll(List.of("best pump?", "best pump?", "best pump?"));

        assertEquals(3, result.size());
        assertTrue(result.stream().allMatch(c -> c == PainPointCluster.PUMP_RECOMMENDATIONS));
        verify(textClassifier, times(1)).generate(anyString());
    }

    // ===== FALLBACK =====

    @Test
    @DisplayName("Пустой и пробельный ввод -> кластер 0 без вызова классификатора")
    void blankInputSkipsCall() {
        List<PainPointCluster> result = classifier.classifyAll(Arrays.asList("", "   ", null));

        assertEquals(List.of(PainPointCluster.GENERAL, PainPointCluster.GENERAL, PainPointCluster.GENERAL), result);
        verifyNoInteractions(textClassifier);
    }

    @Test
    @DisplayName("Провайдер недоступен (retriable) -> все элементы в кластер 0, причина SERVICE_UNAVAILABLE")
    void transientFailureFallsBack() {
        when(textClassifier.generate(anyString()))
                .thenThrow(new AIGatewayException("503", ErrorCode.AI_SERVICE_ERROR.getCode(), true));

        List<PainPointCluster> result = classifier.classifyAll(List.of("a query", "", "another query"));

        assertEquals(List.of(PainPointCluster.GENERAL, PainPointCluster.GENERAL, PainPointCluster.GENERAL), result);
        verify(textClassifier, times(2)).generate(anyString());
        assertEquals(2.0, meterRegistry.get("analytics.classifier.fallbacks").tag("reason", "SERVICE_UNAVAILABLE").counter().count());
        assertEquals(0.0, meterRegistry.get("analytics.classifier.fallbacks").tag("reason", "SERVICE_ERROR").counter().count());
        assertEquals(2.0, meterRegistry.get("analytics.classifier.calls").tag("result", "failure").counter().count());
    }

    @Test
    @DisplayName("Постоянная ошибка (non-retriable) -> кластер 0, причина SERVICE_ERROR")
    void permanentFailureFallsBack() {
        when(textClassifier.generate(anyString()))
                .thenThrow(new AIGatewayException("no key", ErrorCode.AI_SERVICE_ERROR.getCode(), false));

        ClassificationOutcome outcome = classifier.classify("a query");
        List<PainPointCluster> result = classifier.classifyAll(List.of("a query"));

        assertEquals(ClassificationOutcome.FailureReason.SERVICE_ERROR, outcome.failure());
        assertEquals(List.of(PainPointCluster.GENERAL), result);
        assertEquals(1.0, meterRegistry.get("analytics.classifier.fallbacks").tag("reason", "SERVICE_ERROR").counter().count());
        assertEquals(0.0, meterRegistry.get("analytics.classifier.fallbacks").tag("reason", "SERVICE_UNAVAILABLE").counter().count());
    }

    @Test
    @DisplayName("Ошибка вне шлюза (не ApplicationException) -> SERVICE_ERROR")
    void unexpectedExceptionIsNotRetriable() {
        when(textClassifier.generate(anyString())).thenThrow(new IllegalStateException("bug"));

        ClassificationOutcome outcome = classifier.classify("a query");

        assertEquals(ClassificationOutcome.FailureReason.SERVICE_ERROR, outcome.failure());
    }

    @Test
    @DisplayName("Цифра вне диапазона 0-4 -> кластер 0 (OUT_OF_RANGE)")
    void outOfRangeFallsBack() {
        when(textClassifier.generate(anyString())).thenReturn("7");

        List<PainPointCluster> result = classifier.classifyAll(List.of("weird"));

        assertEquals(List.of(PainPointCluster.GENERAL), result);
        assertEquals(1.0, meterRegistry.get("analytics.classifier.fallbacks").tag("reason", "OUT_OF_RANGE").counter().count());
    }

    @Test
    @DisplayName("Ответ без цифр -> кластер 0 (NO_DIGIT)")
    void noDigitFallsBack() {
        when(textClassifier.generate(anyString())).thenReturn("I am not sure");

        ClassificationOutcome outcome = classifier.classify("weird");
        List<PainPointCluster> result = classifier.classifyAll(List.of("weird"));

        assertFalse(outcome.isSuccess());
        assertEquals(ClassificationOutcome.FailureReason.NO_DIGIT, outcome.failure());
        assertEquals(List.of(PainPointCluster.GENERAL), result);
    }

    @Test
    @DisplayName("Промпт содержит все примеры кластеров и запрос")
    void promptContainsFewShotPreamble() {
        String prompt = new PainPointPromptBuilder().build("Do you carry CX580XRE?");

        for (PainPointCluster cluster : PainPointCluster.values()) {
            assertTrue(prompt.contains("Cluster " + cluster.getId() + ": "));
            cluster.getExamples().forEach(example -> assertTrue(prompt.contains(example)));
        }
        assertTrue(prompt.contains("Respond ONLY with the cluster number (0-4)."));
        assertTrue(prompt.endsWith("Query to classify: \"Do you carry CX580XRE?\"\n\nCluster number:"));
    }
}
