package com.fintech.supply.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one operation's circuit breaker, for health reporting.
 */
@Value
@Builder
public class CircuitBreakerStatus {

    /**
     * Consecutive calls that exhausted all retry attempts.
     */
    int count;

    Instant lastFailureTime;

    @JsonProperty("isOpen")
    boolean open;
}
