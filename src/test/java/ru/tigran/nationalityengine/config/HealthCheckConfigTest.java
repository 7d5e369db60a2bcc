package ru.tigran.nationalityengine.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HealthCheckConfig модульные тесты")
class HealthCheckConfigTest {

    private static final String BASE_URL = "https://api.nationalize.io";

    @Test
    @DisplayName("Закрытый circuit breaker - UP")
    void closedBreakerIsUp() {
        CircuitBreaker circuitBreaker = CircuitBreaker.ofDefaults("nationalize");

        Health health = HealthCheckConfig.health(circuitBreaker, BASE_URL);

        assertEquals(Status.UP, health.getStatus());
        assertEquals(BASE_URL, health.getDetails().get("baseUrl"));
        assertEquals("CLOSED", health.getDetails().get("circuitBreaker"));
    }

    @Test
    @DisplayName("Открытый circuit breaker - DOWN")
    void openBreakerIsDown() {
        CircuitBreaker circuitBreaker = CircuitBreaker.ofDefaults("nationalize");
        circuitBreaker.transitionToOpenState();

        assertEquals(Status.DOWN, HealthCheckConfig.health(circuitBreaker, BASE_URL).getStatus());
    }

    @Test
    @DisplayName("Полуоткрытый circuit breaker - UNKNOWN")
    void halfOpenBreakerIsUnknown() {
        CircuitBreaker circuitBreaker = CircuitBreaker.ofDefaults("nationalize");
        circuitBreaker.transitionToOpenState();
        circuitBreaker.transitionToHalfOpenState();

        assertEquals(Status.UNKNOWN, HealthCheckConfig.health(circuitBreaker, BASE_URL).getStatus());
    }
}
