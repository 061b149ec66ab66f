package com.fintech.supply.health;

import com.fintech.supply.dto.CircuitBreakerStatus;
import com.fintech.supply.service.SupplyReconciliationService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator view of the fetch circuit breakers.
 * <p>
 * An open breaker only suspends one upstream operation for its cool-down, so the
 * service reports DEGRADED rather than DOWN and stays in rotation.
 */
@Component("circuitBreakers")
@RequiredArgsConstructor
public class CircuitBreakerHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final SupplyReconciliationService reconciliationService;

    @Override
    public Health health() {
        Map<String, CircuitBreakerStatus> breakers = reconciliationService.getCircuitBreakerStatus();
        long openCount = breakers.values().stream().filter(CircuitBreakerStatus::isOpen).count();

        Health.Builder builder = openCount == 0 ? Health.up() : Health.status(DEGRADED);
        return builder
                .withDetail("openBreakers", openCount)
                .withDetail("breakers", breakers)
                .build();
    }
}
