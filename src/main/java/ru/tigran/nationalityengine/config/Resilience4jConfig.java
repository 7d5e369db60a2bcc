package ru.tigran.nationalityengine.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.nationalityengine.exception.UpstreamMalformedException;
import ru.tigran.nationalityengine.exception.UpstreamUnavailableException;

import java.time.Duration;

/**
 * Конфигурация Resilience4j для защиты от отказов внешних сервисов
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    public static final String NATIONALIZE = "nationalize";
    public static final String REST_COUNTRIES = "restCountries";
    public static final String CANDIDATE_FETCH = "candidateFetch";

    /**
     * Открывается при 50% ошибок в окне из 10 вызовов (минимум 5),
     * остается открытым 20 секунд, затем HALF_OPEN.
     * Некорректный ответ сервиса не считается отказом: сервис доступен.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(NationalityEngineProperties properties) {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(
            CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f)
                .slowCallRateThreshold(50.0f)
                .slowCallDurationThreshold(properties.getExternal().getRequestTimeout())
                .permittedNumberOfCallsInHalfOpenState(3)
                .minimumNumberOfCalls(5)
                .slidingWindowSize(10)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .waitDurationInOpenState(Duration.ofSeconds(20))
                .recordExceptions(UpstreamUnavailableException.class)
                .ignoreExceptions(UpstreamMalformedException.class, IllegalArgumentException.class)
                .build()
        );

        registry.getEventPublisher()
                .onEntryAdded(event -> log.info("CircuitBreaker created: {}", event.getAddedEntry().getName()))
                .onEntryRemoved(event -> log.info("CircuitBreaker removed: {}", event.getRemovedEntry().getName()))
                .onEntryReplaced(event -> log.info("CircuitBreaker replaced: {}", event.getNewEntry().getName()));

        return registry;
    }

    @Bean
    public CircuitBreaker nationalizeCircuitBreaker(CircuitBreakerRegistry registry) {
        return withLogging(registry.circuitBreaker(NATIONALIZE));
    }

    @Bean
    public CircuitBreaker restCountriesCircuitBreaker(CircuitBreakerRegistry registry) {
        return withLogging(registry.circuitBreaker(REST_COUNTRIES));
    }

    /**
     * Повтор получения кандидатов. По умолчанию одна попытка (без повторов).
     * Повторяется только UpstreamUnavailableException.
     */
    @Bean
    public Retry candidateFetchRetry(NationalityEngineProperties properties) {
        NationalityEngineProperties.Prediction prediction = properties.getPrediction();
        Retry retry = Retry.of(CANDIDATE_FETCH, RetryConfig.custom()
                .maxAttempts(Math.max(1, prediction.getCandidateFetchAttempts()))
                .waitDuration(prediction.getCandidateFetchBackoff())
                .retryExceptions(UpstreamUnavailableException.class)
                .build());

        retry.getEventPublisher()
                .onRetry(event -> log.warn("Retrying candidate fetch, attempt {}: {}",
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"));

        return retry;
    }

    private CircuitBreaker withLogging(CircuitBreaker circuitBreaker) {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("CircuitBreaker {} state changed: {} -> {}",
                    event.getCircuitBreakerName(),
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()))
                .onError(event -> log.debug("CircuitBreaker {} recorded error: {}",
                    event.getCircuitBreakerName(), event.getThrowable().getMessage()));
        return circuitBreaker;
    }
}
