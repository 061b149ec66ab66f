package com.fintech.supply.service;

import com.fintech.supply.config.ReconciliationProperties;
import com.fintech.supply.dto.CircuitBreakerStatus;
import com.fintech.supply.dto.RetryResult;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs fallible source fetches with bounded retry, capped exponential backoff
 * and one circuit breaker per operation name.
 * <p>
 * Retry: up to {@code maxAttempts} attempts, sleeping
 * {@code min(baseDelay * multiplier^(attempt-1), maxDelay)} between them.
 * <p>
 * Circuit breaker: every call that exhausts its attempts counts as one failure
 * for its operation name; a success resets the count. Once {@code threshold}
 * consecutive failures are recorded the name fails fast, with no attempt, until
 * the cool-down has elapsed since the last failure. Once the cool-down has
 * elapsed the count starts again from zero, whether or not the breaker opened.
 * Names never affect each other.
 * <p>
 * The breaker registry is the only state shared between concurrent requests.
 * Each breaker's check-and-reset and record steps are serialised on the breaker.
 */
@Slf4j
public class RetryExecutor {

    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryTemplate retryTemplate;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration cooldown;

    private final Map<String, Instant> lastFailures = new ConcurrentHashMap<>();

    public RetryExecutor(ReconciliationProperties properties,
                         CircuitBreakerRegistry circuitBreakerRegistry,
                         Sleeper sleeper,
                         Clock clock) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.clock = clock;
        this.maxAttempts = properties.getMaxAttempts();
        this.cooldown = Duration.ofMillis(properties.getCircuitBreakerCooldownMs());

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(properties.getBaseDelayMs());
        backOffPolicy.setMultiplier(properties.getBackoffMultiplier());
        backOffPolicy.setMaxInterval(properties.getMaxDelayMs());
        backOffPolicy.setSleeper(sleeper);

        this.retryTemplate = new RetryTemplate();
        this.retryTemplate.setRetryPolicy(new SimpleRetryPolicy(maxAttempts));
        this.retryTemplate.setBackOffPolicy(backOffPolicy);
    }

    /**
     * Executes {@code operation} under the retry policy and the breaker for
     * {@code operationName}. Never throws for an {@link Exception} raised by the
     * operation: failures are reported in the returned result.
     */
    public <T> RetryResult<T> executeWithRetry(Callable<T> operation, String operationName) {
        long startTime = clock.millis();
        CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker(operationName);

        if (!acquirePermission(breaker)) {
            log.warn("Circuit breaker open for {}, skipping call", operationName);
            return RetryResult.circuitOpen(
                    String.format("Circuit breaker open for %s. Too many recent failures.", operationName),
                    clock.millis() - startTime);
        }

        AtomicInteger attempts = new AtomicInteger();
        RetryCallback<T, Exception> callback = context -> {
            int attempt = attempts.incrementAndGet();
            log.debug("Attempting {} (attempt {}/{})", operationName, attempt, maxAttempts);
            try {
                return operation.call();
            } catch (Exception e) {
                log.warn("{} attempt {} failed: {}", operationName, attempt, e.getMessage());
                throw e;
            }
        };

        try {
            T data = retryTemplate.execute(callback);
            recordSuccess(breaker);
            return RetryResult.success(data, attempts.get(), clock.millis() - startTime);
        } catch (Exception e) {
            long durationMs = clock.millis() - startTime;
            recordFailure(breaker, e, durationMs);
            String message = e.getMessage() != null ? e.getMessage() : "Unknown error";
            return RetryResult.failure(message, attempts.get(), durationMs);
        }
    }

    /**
     * Snapshot of every operation with at least one recorded failure. Failures
     * older than the cool-down are discarded first.
     */
    public Map<String, CircuitBreakerStatus> getCircuitBreakerStatus() {
        Map<String, CircuitBreakerStatus> status = new TreeMap<>();
        for (CircuitBreaker breaker : circuitBreakerRegistry.getAllCircuitBreakers()) {
            synchronized (breaker) {
                expireStaleFailures(breaker);
                int count = breaker.getMetrics().getNumberOfFailedCalls();
                if (count == 0) {
                    continue;
                }
                status.put(breaker.getName(), CircuitBreakerStatus.builder()
                        .count(count)
                        .lastFailureTime(lastFailures.get(breaker.getName()))
                        .open(breaker.getState() == CircuitBreaker.State.OPEN)
                        .build());
            }
        }
        return status;
    }

    /**
     * Closes every breaker and forgets all recorded failures.
     */
    public void resetAll() {
        for (CircuitBreaker breaker : circuitBreakerRegistry.getAllCircuitBreakers()) {
            synchronized (breaker) {
                reset(breaker);
            }
        }
    }

    /**
     * Cool-down is measured on the injected clock, so the breaker's own
     * open-state timer is never consulted.
     */
    private boolean acquirePermission(CircuitBreaker breaker) {
        synchronized (breaker) {
            expireStaleFailures(breaker);
            return breaker.getState() != CircuitBreaker.State.OPEN;
        }
    }

    private void expireStaleFailures(CircuitBreaker breaker) {
        Instant lastFailure = lastFailures.get(breaker.getName());
        if (lastFailure != null && clock.instant().isAfter(lastFailure.plus(cooldown))) {
            log.info("Cool-down elapsed for {}, resetting circuit breaker", breaker.getName());
            reset(breaker);
        }
    }

    private void recordSuccess(CircuitBreaker breaker) {
        synchronized (breaker) {
            if (breaker.getMetrics().getNumberOfFailedCalls() > 0
                    || breaker.getState() != CircuitBreaker.State.CLOSED) {
                reset(breaker);
            }
        }
    }

    private void recordFailure(CircuitBreaker breaker, Exception error, long durationMs) {
        synchronized (breaker) {
            breaker.onError(durationMs, TimeUnit.MILLISECONDS, error);
            lastFailures.put(breaker.getName(), clock.instant());

            if (breaker.getState() == CircuitBreaker.State.OPEN) {
                log.error("Circuit breaker triggered for {} after {} failures",
                        breaker.getName(), breaker.getMetrics().getNumberOfFailedCalls());
            }
        }
    }

    private void reset(CircuitBreaker breaker) {
        breaker.reset();
        lastFailures.remove(breaker.getName());
    }
}
