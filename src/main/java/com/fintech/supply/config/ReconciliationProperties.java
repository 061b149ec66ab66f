package com.fintech.supply.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the reconciliation engine, bound from {@code reconciliation.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    /**
     * Layer two network subgraph URL.
     */
    private String l2Endpoint;

    /**
     * Block explorer key used to resolve timestamps to block numbers.
     */
    private String etherscanApiKey;

    /**
     * Validate raw facts and the reconciled result before returning them.
     */
    private boolean enableValidation = true;

    @Min(1)
    private int maxAttempts = 3;

    @Min(1)
    private long baseDelayMs = 1000;

    @Min(1)
    private long maxDelayMs = 8000;

    @DecimalMin("1.0")
    private double backoffMultiplier = 2;

    /**
     * Consecutive exhausted calls after which an operation is suspended.
     */
    @Min(1)
    private int circuitBreakerThreshold = 5;

    @Min(1)
    private long circuitBreakerCooldownMs = 300_000;
}
