package ru.tigran.chatanalytics.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.io.IOException;

/**
 * Конфигурация для web (CORS, журнал запросов)
 */
@Slf4j
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final String[] allowedOrigins;

    public WebConfig(@Value("${cors.allowed-origins:http://localhost:3000}") String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    /**
     * Дашборд только читает данные: KPI и health доступны на GET
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods("GET", "OPTIONS")
                .allowedHeaders("Authorization", "Content-Type")
                .allowCredentials(true)
                .maxAge(3600);
        registry.addMapping("/actuator/health/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods("GET");
    }

    @Bean
    public OncePerRequestFilter requestLoggingFilter(
            @Value("${app.web.slow-request-threshold-ms:2000}") long slowRequestThresholdMs
    ) {
        return new RequestLoggingFilter(slowRequestThresholdMs);
    }

    /**
     * Одна строка на запрос; ошибки и медленные KPI поднимаются выше debug.
     * Строка запроса пишется только для ошибок, чтобы видеть отклоненные фильтры.
     */
    static class RequestLoggingFilter extends OncePerRequestFilter {

        private final long slowRequestThresholdMs;

        RequestLoggingFilter(long slowRequestThresholdMs) {
            this.slowRequestThresholdMs = slowRequestThresholdMs;
        }

        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain
        ) throws ServletException, IOException {
            long started = System.nanoTime();
            try {
                filterChain.doFilter(request, response);
            } finally {
                long elapsedMs = (System.nanoTime() - started) / 1_000_000;
                int status = response.getStatus();
                String path = request.getRequestURI();

                if (status >= 400) {
                    log.warn("{} {} -> {} in {} ms [{}]",
                            request.getMethod(), path, status, elapsedMs, request.getQueryString());
                } else if (elapsedMs > slowRequestThresholdMs) {
                    log.info("{} {} -> {} in {} ms (slow)", request.getMethod(), path, status, elapsedMs);
                } else {
                    log.debug("{} {} -> {} in {} ms", request.getMethod(), path, status, elapsedMs);
                }
            }
        }
    }
}
