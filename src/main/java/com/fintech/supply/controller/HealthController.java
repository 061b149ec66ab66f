package com.fintech.supply.controller;

import com.fintech.supply.config.ReconciliationProperties;
import com.fintech.supply.dto.CircuitBreakerStatus;
import com.fintech.supply.service.LayerOneSupplyClient;
import com.fintech.supply.service.LayerTwoSupplyClient;
import com.fintech.supply.service.SupplyReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Lightweight health and diagnostics endpoints for load balancers and operators.
 * Unlike the Actuator health endpoint these report per-source state.
 */
@RestController
@Slf4j
@Tag(name = "Health", description = "Service and upstream source health")
public class HealthController {

    static final String HEALTHY = "healthy";
    static final String DEGRADED = "degraded";
    static final String UNHEALTHY = "unhealthy";

    private final SupplyReconciliationService reconciliationService;
    private final LayerOneSupplyClient layerOneClient;
    private final LayerTwoSupplyClient layerTwoClient;
    private final ReconciliationProperties properties;
    private final Clock clock;
    private final String version;

    public HealthController(SupplyReconciliationService reconciliationService,
                            LayerOneSupplyClient layerOneClient,
                            LayerTwoSupplyClient layerTwoClient,
                            ReconciliationProperties properties,
                            Clock clock,
                            @Value("${supply.version:1.0.0}") String version) {
        this.reconciliationService = reconciliationService;
        this.layerOneClient = layerOneClient;
        this.layerTwoClient = layerTwoClient;
        this.properties = properties;
        this.clock = clock;
        this.version = version;
    }

    @Operation(summary = "Service health",
            description = "Degraded when any fetch operation has an open circuit breaker.")
    @ApiResponse(responseCode = "200", description = "Health reported")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(circuitBreakerHealth(null));
    }

    @Operation(summary = "Combined layer one and layer two health")
    @ApiResponse(responseCode = "200", description = "Health reported")
    @GetMapping("/health/combined")
    public ResponseEntity<Map<String, Object>> combinedHealth() {
        return ResponseEntity.ok(circuitBreakerHealth("L1+L2 Combined"));
    }

    @Operation(summary = "Layer one source health",
            description = "Probes the layer one source once, without retry.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Source answered"),
            @ApiResponse(responseCode = "503", description = "Source failed")
    })
    @GetMapping("/health/l1")
    public ResponseEntity<Map<String, Object>> layerOneHealth() {
        return probe(layerOneClient.getSourceName(), layerOneClient::fetchLatest);
    }

    @Operation(summary = "Layer two source health",
            description = "Probes the layer two source once, without retry.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Source answered"),
            @ApiResponse(responseCode = "503", description = "Source failed")
    })
    @GetMapping("/health/l2")
    public ResponseEntity<Map<String, Object>> layerTwoHealth() {
        return probe(layerTwoClient.getSourceName(), () -> layerTwoClient.fetchLatest(properties.getL2Endpoint()));
    }

    @Operation(summary = "Liveness ping")
    @GetMapping("/ping")
    public ResponseEntity<Map<String, Object>> ping() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", HEALTHY);
        response.put("timestamp", Instant.now(clock).toString());
        response.put("version", version);
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Effective configuration",
            description = "Shows which upstreams are configured and the retry settings. Secrets are never included.")
    @GetMapping("/config")
    public ResponseEntity<Map<String, Object>> config() {
        Map<String, Object> retryConfig = new LinkedHashMap<>();
        retryConfig.put("maxAttempts", properties.getMaxAttempts());
        retryConfig.put("baseDelayMs", properties.getBaseDelayMs());
        retryConfig.put("maxDelayMs", properties.getMaxDelayMs());
        retryConfig.put("backoffMultiplier", properties.getBackoffMultiplier());
        retryConfig.put("circuitBreakerThreshold", properties.getCircuitBreakerThreshold());
        retryConfig.put("circuitBreakerCooldownMs", properties.getCircuitBreakerCooldownMs());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("l2SubgraphConfigured", isSet(properties.getL2Endpoint()));
        response.put("etherscanConfigured", isSet(properties.getEtherscanApiKey()));
        response.put("retryConfig", retryConfig);
        response.put("validationEnabled", properties.isEnableValidation());
        response.put("timestamp", Instant.now(clock).toString());
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> circuitBreakerHealth(String service) {
        Map<String, CircuitBreakerStatus> breakers = reconciliationService.getCircuitBreakerStatus();
        boolean anyOpen = breakers.values().stream().anyMatch(CircuitBreakerStatus::isOpen);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", anyOpen ? DEGRADED : HEALTHY);
        if (service != null) {
            response.put("service", service);
        }
        response.put("circuitBreakers", breakers);
        response.put("timestamp", Instant.now(clock).toString());
        return response;
    }

    private ResponseEntity<Map<String, Object>> probe(String source, Callable<?> fetch) {
        long start = clock.millis();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("source", source);
        try {
            fetch.call();
            response.put("status", HEALTHY);
            response.put("durationMs", clock.millis() - start);
            response.put("timestamp", Instant.now(clock).toString());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.warn("Health probe of {} failed: {}", source, e.getMessage());
            response.put("status", UNHEALTHY);
            response.put("error", e.getMessage());
            response.put("durationMs", clock.millis() - start);
            response.put("timestamp", Instant.now(clock).toString());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
