package ru.tigran.chatanalytics.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import ru.tigran.chatanalytics.exception.ConfigurationException;
import ru.tigran.chatanalytics.model.ProductContext;
import ru.tigran.chatanalytics.query.DatasetResolver;
import ru.tigran.chatanalytics.repository.InteractionLogRepository;
import ru.tigran.chatanalytics.service.AIGatewayService;

/**
 * Конфигурация health checks для внешних зависимостей
 */
@Slf4j
@Configuration
public class HealthCheckConfig {

    /**
     * Версия сервера БД и количество строк в каждом журнале взаимодействий
     */
    @Bean
    public HealthIndicator datasetsHealthIndicator(InteractionLogRepository repository, DatasetResolver datasetResolver) {
        return () -> {
            try {
                Health.Builder builder = Health.up().withDetail("server_version", repository.serverVersion());
                for (ProductContext context : ProductContext.values()) {
                    String table = datasetResolver.tableFor(context);
                    builder.withDetail(context.getValue() + "_rows", repository.countRows(table));
                }
                return builder.build();
            } catch (DataAccessException | ConfigurationException e) {
                log.warn("Datasets health check failed: {}", e.getMessage());
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        };
    }

    /**
     * Состояние классификатора: ключ API и circuit breaker. Внешний API не вызывается
     */
    @Bean
    public HealthIndicator classifierHealthIndicator(AIGatewayService aiGatewayService) {
        return () -> {
            CircuitBreaker.State state = aiGatewayService.circuitState();
            Health.Builder builder = aiGatewayService.isConfigured() && state != CircuitBreaker.State.OPEN
                    ? Health.up()
                    : Health.status("DEGRADED");
            return builder
                    .withDetail("model", aiGatewayService.getModel())
                    .withDetail("api_key_configured", aiGatewayService.isConfigured())
                    .withDetail("circuit_breaker", state.name())
                    .build();
        };
    }
}
