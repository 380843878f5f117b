package com.openforge.promptyoself.config;

import com.openforge.promptyoself.letta.LettaClient;
import com.openforge.promptyoself.letta.LettaProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring for the single downstream, the Letta server.
 * One named instance of each, "letta", wrapped around every prompt delivery.
 */
@Configuration
public class Resilience4jConfig {

    static final String LETTA = "letta";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 deliveries fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(60))
                .recordExceptions(LettaClient.LettaException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(LETTA);
        return registry;
    }

    @Bean
    public CircuitBreaker lettaCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(LETTA);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry(LettaProperties properties) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.maxRetries()))
                // exponential back-off from 1 s; with the default 3 attempts the waits are 1 s then 2 s
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofSeconds(1), 2.0))
                .retryExceptions(LettaClient.LettaException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(LETTA);
        return registry;
    }

    @Bean
    public Retry lettaRetry(RetryRegistry registry) {
        return registry.retry(LETTA);
    }
}
