package com.fintech.supply.config;

import com.fintech.supply.service.RetryExecutor;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.time.Clock;
import java.time.Duration;

/**
 * Configuration for the per-operation circuit breakers and the retry executor.
 * <p>
 * One breaker exists per operation name (for example {@code L1_LATEST_GLOBAL_STATE}).
 * A breaker counts calls that exhausted every retry attempt:
 * - CLOSED: calls pass through
 * - OPEN: {@code threshold} consecutive exhausted calls, calls fail fast
 * - after the cool-down since the last failure the breaker is reset, whatever its state
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ReconciliationProperties properties,
                                                         MeterRegistry meterRegistry) {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(circuitBreakerConfig(properties));
        TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(registry).bindTo(meterRegistry);
        return registry;
    }

    @Bean
    public RetryExecutor retryExecutor(ReconciliationProperties properties,
                                       CircuitBreakerRegistry circuitBreakerRegistry,
                                       Clock clock) {
        return new RetryExecutor(properties, circuitBreakerRegistry, new ThreadWaitSleeper(), clock);
    }

    /**
     * A count-based window as wide as the threshold with a 100% failure rate
     * opens exactly after {@code threshold} consecutive failures.
     */
    public static CircuitBreakerConfig circuitBreakerConfig(ReconciliationProperties properties) {
        int threshold = properties.getCircuitBreakerThreshold();
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100)
                // RetryExecutor closes the breaker once the cool-down has passed on the application clock
                .waitDurationInOpenState(Duration.ofMillis(properties.getCircuitBreakerCooldownMs()))
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
    }
}
