package ru.tigran.chatanalytics.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.chatanalytics.exception.AIGatewayException;

import java.time.Duration;

/**
 * Конфигурация Resilience4j для вызовов классификатора.
 * Повторных попыток нет: пока circuit breaker открыт, каждый запрос сразу получает fallback-кластер.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    static final String TEXT_CLASSIFIER = "textClassifier";

    /**
     * Окно из последних N вызовов; при доле ошибок выше порога breaker открывается
     * на {@code wait-in-open} и затем пропускает несколько пробных вызовов (HALF_OPEN).
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            @Value("${app.classifier.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${app.classifier.circuit-breaker.sliding-window-size:20}") int slidingWindowSize,
            @Value("${app.classifier.circuit-breaker.minimum-calls:5}") int minimumCalls,
            @Value("${app.classifier.circuit-breaker.wait-in-open:20s}") Duration waitInOpen,
            @Value("${app.classifier.circuit-breaker.slow-call-threshold:15s}") Duration slowCallThreshold
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(minimumCalls)
                .failureRateThreshold(failureRateThreshold)
                .slowCallDurationThreshold(slowCallThreshold)
                .slowCallRateThreshold(100.0f)
                .waitDurationInOpenState(waitInOpen)
                .permittedNumberOfCallsInHalfOpenState(2)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                // только сбои провайдера; ошибки в нашем коде не должны открывать breaker
                .recordExceptions(AIGatewayException.class)
                .build();

        log.info("Classifier circuit breaker: window={}, min calls={}, failure threshold={}%, open for {}",
                slidingWindowSize, minimumCalls, failureRateThreshold, waitInOpen);
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public CircuitBreaker textClassifierCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker(TEXT_CLASSIFIER);

        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("Classifier circuit {}",
                        event.getStateTransition()))
                .onCallNotPermitted(event -> log.debug("Classifier call rejected, circuit is {}",
                        circuitBreaker.getState()));

        return circuitBreaker;
    }
}
