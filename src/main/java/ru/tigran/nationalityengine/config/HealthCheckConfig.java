package ru.tigran.nationalityengine.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация health checks для внешних сервисов.
 * Состояние берется из circuit breaker, сами сервисы не пингуются:
 * у Nationalize.io дневной лимит запросов.
 */
@Slf4j
@Configuration
public class HealthCheckConfig {

    @Bean
    public HealthIndicator nationalizeHealthIndicator(
            @Qualifier("nationalizeCircuitBreaker") CircuitBreaker circuitBreaker,
            NationalityEngineProperties properties
    ) {
        return () -> health(circuitBreaker, properties.getExternal().getNationalizeBaseUrl());
    }

    @Bean
    public HealthIndicator restCountriesHealthIndicator(
            @Qualifier("restCountriesCircuitBreaker") CircuitBreaker circuitBreaker,
            NationalityEngineProperties properties
    ) {
        return () -> health(circuitBreaker, properties.getExternal().getCountryBaseUrl());
    }

    static Health health(CircuitBreaker circuitBreaker, String baseUrl) {
        CircuitBreaker.State state = circuitBreaker.getState();
        CircuitBreaker.Metrics metrics = circuitBreaker.getMetrics();
        Health.Builder builder = switch (state) {
            case OPEN, FORCED_OPEN -> Health.down();
            case HALF_OPEN -> Health.unknown();
            default -> Health.up();
        };
        if (state == CircuitBreaker.State.OPEN) {
            log.warn("{} health check: circuit breaker is OPEN", circuitBreaker.getName());
        }
        return builder
                .withDetail("baseUrl", baseUrl)
                .withDetail("circuitBreaker", state.name())
                .withDetail("failureRate", metrics.getFailureRate())
                .withDetail("bufferedCalls", metrics.getNumberOfBufferedCalls())
                .build();
    }
}
