package com.fintech.supply.service;

import com.fintech.supply.config.ReconciliationProperties;
import com.fintech.supply.dto.CircuitBreakerStatus;
import com.fintech.supply.dto.LayerOneSupply;
import com.fintech.supply.dto.LayerTwoSupply;
import com.fintech.supply.dto.ReconciledSupply;
import com.fintech.supply.dto.ReconciliationResult;
import com.fintech.supply.dto.RetryResult;
import com.fintech.supply.dto.ValidationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Produces the reconciled token supply from the layer one and layer two sources.
 * <p>
 * Key Design Decisions:
 * 1. Parallelism: both layers are fetched concurrently and both are awaited,
 *    a failure on one side never cancels the other
 * 2. All-or-nothing: any fetch or validation error fails the whole request,
 *    partial figures are never returned
 * 3. Resilience: each layer is fetched under its own retry/circuit breaker name,
 *    so an open breaker on one layer never blocks the other
 * 4. Observability: emits metrics for every run and logs validation warnings
 */
@Service
@Slf4j
public class SupplyReconciliationService {

    static final String L1_LATEST_OPERATION = "L1_LATEST_GLOBAL_STATE";
    static final String L2_LATEST_OPERATION = "L2_LATEST_SUPPLY";
    static final String L1_BLOCK_OPERATION = "L1_BLOCK_GLOBAL_STATE";
    static final String L2_BLOCK_OPERATION = "L2_BLOCK_SUPPLY";

    private final LayerOneSupplyClient layerOneClient;
    private final LayerTwoSupplyClient layerTwoClient;
    private final BlockResolver blockResolver;
    private final RetryExecutor retryExecutor;
    private final SupplyValidator validator;
    private final SupplyReconciler reconciler;
    private final ReconciliationProperties properties;
    private final Executor fetchExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // Metrics
    private Counter reconciliationCounter;
    private Counter successCounter;
    private Counter failureCounter;
    private Counter circuitOpenCounter;
    private Timer reconciliationTimer;

    public SupplyReconciliationService(LayerOneSupplyClient layerOneClient,
                                       LayerTwoSupplyClient layerTwoClient,
                                       BlockResolver blockResolver,
                                       RetryExecutor retryExecutor,
                                       SupplyValidator validator,
                                       SupplyReconciler reconciler,
                                       ReconciliationProperties properties,
                                       @Qualifier("supplyFetchExecutor") Executor fetchExecutor,
                                       MeterRegistry meterRegistry,
                                       Clock clock) {
        this.layerOneClient = layerOneClient;
        this.layerTwoClient = layerTwoClient;
        this.blockResolver = blockResolver;
        this.retryExecutor = retryExecutor;
        this.validator = validator;
        this.reconciler = reconciler;
        this.properties = properties;
        this.fetchExecutor = fetchExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void initMetrics() {
        reconciliationCounter = Counter.builder("supply.reconciliation.total")
                .description("Total supply reconciliation requests")
                .register(meterRegistry);

        successCounter = Counter.builder("supply.reconciliation.success")
                .description("Reconciliations that produced a supply figure")
                .register(meterRegistry);

        failureCounter = Counter.builder("supply.reconciliation.failure")
                .description("Reconciliations that failed on fetch or validation")
                .register(meterRegistry);

        circuitOpenCounter = Counter.builder("supply.reconciliation.circuit-open")
                .description("Reconciliations rejected by an open circuit breaker")
                .register(meterRegistry);

        reconciliationTimer = Timer.builder("supply.reconciliation.duration")
                .description("Time taken to complete a reconciliation")
                .register(meterRegistry);
    }

    /**
     * Reconciles the most recent supply of both layers.
     */
    public ReconciliationResult reconcileLatest() {
        log.info("Starting reconciliation of latest supply");
        ReconciliationResult result = startResult();
        long startTime = clock.millis();
        reconciliationCounter.increment();

        return reconcile(
                layerOneClient::fetchLatest, L1_LATEST_OPERATION,
                () -> layerTwoClient.fetchLatest(properties.getL2Endpoint()), L2_LATEST_OPERATION,
                result, startTime);
    }

    /**
     * Reconciles supply as of the layer one block produced at or before the
     * given time. Falls back to the latest block when the time cannot be
     * resolved, and per layer to the latest state when a layer has no state
     * for the block.
     *
     * @param timestampSeconds unix time in seconds
     */
    public ReconciliationResult reconcileAtTimestamp(long timestampSeconds) {
        log.info("Starting reconciliation of supply at timestamp {}", timestampSeconds);
        ReconciliationResult result = startResult();
        long startTime = clock.millis();
        reconciliationCounter.increment();

        long blockNumber;
        try {
            blockNumber = resolveBlock(timestampSeconds);
        } catch (Exception e) {
            log.error("Failed to resolve block for timestamp {}: {}", timestampSeconds, e.getMessage(), e);
            result.addError("Timestamp-based reconciliation error: " + e.getMessage());
            return finish(result, startTime);
        }

        log.debug("Timestamp {} resolved to block {}", timestampSeconds, blockNumber);
        return reconcileAtBlock(blockNumber, result, startTime);
    }

    /**
     * Circuit breaker state per fetch operation, for health reporting.
     */
    public Map<String, CircuitBreakerStatus> getCircuitBreakerStatus() {
        return retryExecutor.getCircuitBreakerStatus();
    }

    private ReconciliationResult reconcileAtBlock(long blockNumber, ReconciliationResult result, long startTime) {
        return reconcile(
                () -> layerOneClient.fetchAtBlock(blockNumber).orElseGet(() -> {
                    log.info("No L1 state at block {}, falling back to latest", blockNumber);
                    return layerOneClient.fetchLatest();
                }),
                L1_BLOCK_OPERATION,
                () -> layerTwoClient.fetchAtBlock(blockNumber, properties.getL2Endpoint()).orElseGet(() -> {
                    log.info("No L2 state at block {}, falling back to latest", blockNumber);
                    return layerTwoClient.fetchLatest(properties.getL2Endpoint());
                }),
                L2_BLOCK_OPERATION,
                result, startTime);
    }

    private long resolveBlock(long timestampSeconds) {
        String apiKey = properties.getEtherscanApiKey();
        return blockResolver.resolveBlockForTimestamp(timestampSeconds, apiKey)
                .orElseGet(() -> {
                    log.info("No block found for timestamp {}, using latest block", timestampSeconds);
                    return blockResolver.resolveLatestBlock(apiKey);
                });
    }

    private ReconciliationResult reconcile(Callable<LayerOneSupply> layerOneFetch, String layerOneOperation,
                                           Callable<LayerTwoSupply> layerTwoFetch, String layerTwoOperation,
                                           ReconciliationResult result, long startTime) {
        try {
            CompletableFuture<RetryResult<LayerOneSupply>> layerOneFuture = CompletableFuture.supplyAsync(
                    () -> retryExecutor.executeWithRetry(layerOneFetch, layerOneOperation), fetchExecutor);
            CompletableFuture<RetryResult<LayerTwoSupply>> layerTwoFuture = CompletableFuture.supplyAsync(
                    () -> retryExecutor.executeWithRetry(layerTwoFetch, layerTwoOperation), fetchExecutor);

            // Join, not a race: both sides settle before anything is decided
            CompletableFuture.allOf(layerOneFuture, layerTwoFuture).join();
            RetryResult<LayerOneSupply> layerOneResult = layerOneFuture.join();
            RetryResult<LayerTwoSupply> layerTwoResult = layerTwoFuture.join();

            result.setL1FetchDurationMs(layerOneResult.isSuccess() ? layerOneResult.getTotalDurationMs() : 0);
            result.setL2FetchDurationMs(layerTwoResult.isSuccess() ? layerTwoResult.getTotalDurationMs() : 0);

            if (!layerOneResult.isSuccess()) {
                result.addError("L1 fetch failed: " + layerOneResult.getError());
            }
            if (!layerTwoResult.isSuccess()) {
                result.addError("L2 fetch failed: " + layerTwoResult.getError());
            }
            result.setCircuitOpen(layerOneResult.isCircuitOpen() || layerTwoResult.isCircuitOpen());

            if (result.hasErrors()) {
                return finish(result, startTime);
            }

            LayerOneSupply layerOne = layerOneResult.getData();
            LayerTwoSupply layerTwo = layerTwoResult.getData();

            if (properties.isEnableValidation() && !validateSources(layerOne, layerTwo, result)) {
                return finish(result, startTime);
            }

            ReconciledSupply reconciled = reconciler.reconcile(layerOne, layerTwo);

            if (properties.isEnableValidation()) {
                ValidationResult validation = validator.validateReconciled(reconciled, layerOne, layerTwo);
                validation.getErrors().forEach(e -> result.addError("Reconciliation validation: " + e));
                if (result.hasErrors()) {
                    return finish(result, startTime);
                }
                validation.getWarnings().forEach(w -> log.warn("Reconciliation validation warning: {}", w));
            }

            result.setSuccess(true);
            result.setReconciledSupply(reconciled);
            return finish(result, startTime);

        } catch (Exception e) {
            log.error("Unexpected error during reconciliation: {}", e.getMessage(), e);
            result.addError("Reconciliation error: " + e.getMessage());
            return finish(result, startTime);
        }
    }

    private boolean validateSources(LayerOneSupply layerOne, LayerTwoSupply layerTwo, ReconciliationResult result) {
        ValidationResult layerOneValidation = validator.validateLayerOne(layerOne);
        ValidationResult layerTwoValidation = validator.validateLayerTwo(layerTwo);

        layerOneValidation.getErrors().forEach(e -> result.addError("L1 validation: " + e));
        layerTwoValidation.getErrors().forEach(e -> result.addError("L2 validation: " + e));
        if (result.hasErrors()) {
            return false;
        }

        layerOneValidation.getWarnings().forEach(w -> log.warn("Supply validation warning: {}", w));
        layerTwoValidation.getWarnings().forEach(w -> log.warn("Supply validation warning: {}", w));
        return true;
    }

    private ReconciliationResult startResult() {
        return ReconciliationResult.builder()
                .startedAt(LocalDateTime.now(clock))
                .build();
    }

    private ReconciliationResult finish(ReconciliationResult result, long startTime) {
        result.setCompletedAt(LocalDateTime.now(clock));
        result.setTotalDurationMs(clock.millis() - startTime);
        reconciliationTimer.record(Duration.ofMillis(result.getTotalDurationMs()));

        if (result.isSuccess()) {
            successCounter.increment();
            log.info("Reconciliation completed in {}ms (L1 fetch {}ms, L2 fetch {}ms)",
                    result.getTotalDurationMs(), result.getL1FetchDurationMs(), result.getL2FetchDurationMs());
        } else {
            failureCounter.increment();
            if (result.isCircuitOpen()) {
                circuitOpenCounter.increment();
            }
            log.warn("Reconciliation failed after {}ms: {}", result.getTotalDurationMs(), result.getErrors());
        }
        return result;
    }
}
