package com.fintech.supply.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one reconciliation request.
 * Either {@code success} with a reconciled supply, or a failure with the
 * aggregated errors of both layers. Never both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private boolean success;

    private ReconciledSupply reconciledSupply;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    /**
     * Set when at least one layer was rejected by an open circuit breaker,
     * so callers can report degraded service rather than a generic failure.
     */
    private boolean circuitOpen;

    private long l1FetchDurationMs;
    private long l2FetchDurationMs;
    private long totalDurationMs;

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public void addError(String error) {
        if (this.errors == null) {
            this.errors = new ArrayList<>();
        }
        this.errors.add(error);
    }

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
