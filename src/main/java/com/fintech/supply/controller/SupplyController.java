package com.fintech.supply.controller;

import com.fintech.supply.dto.ReconciledSupply;
import com.fintech.supply.dto.ReconciliationResult;
import com.fintech.supply.service.SupplyReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Public supply endpoints.
 * <p>
 * Every endpoint reconciles on request, optionally as of a unix timestamp.
 * A reconciliation that fails for any reason answers 503 with the collected
 * errors; figures are never served partially.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Supply", description = "Reconciled token supply across layer one and layer two")
public class SupplyController {

    static final String FAILURE_MESSAGE = "Failed to fetch deterministic supply data";

    private final SupplyReconciliationService reconciliationService;
    private final Clock clock;

    @Operation(
            summary = "Total supply",
            description = "Returns the reconciled total supply in whole tokens as plain text."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reconciled total supply",
                    content = @Content(mediaType = "text/plain")),
            @ApiResponse(responseCode = "400", description = "Timestamp is not a valid unix time"),
            @ApiResponse(responseCode = "503", description = "Reconciliation failed")
    })
    @GetMapping("/token-supply")
    public ResponseEntity<Object> getTokenSupply(
            @Parameter(description = "Unix time in seconds; latest when omitted")
            @RequestParam(required = false) Long timestamp) {
        return respondWithAmount(timestamp, ReconciledSupply::getTotalSupply);
    }

    @Operation(
            summary = "Circulating supply",
            description = "Returns the reconciled circulating supply in whole tokens as plain text."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reconciled circulating supply",
                    content = @Content(mediaType = "text/plain")),
            @ApiResponse(responseCode = "400", description = "Timestamp is not a valid unix time"),
            @ApiResponse(responseCode = "503", description = "Reconciliation failed")
    })
    @GetMapping("/circulating-supply")
    public ResponseEntity<Object> getCirculatingSupply(
            @Parameter(description = "Unix time in seconds; latest when omitted")
            @RequestParam(required = false) Long timestamp) {
        return respondWithAmount(timestamp, ReconciledSupply::getCirculatingSupply);
    }

    @Operation(
            summary = "Global supply state",
            description = "Returns every reconciled figure together with the layer one and layer two facts it was derived from."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reconciled supply",
                    content = @Content(schema = @Schema(implementation = ReconciledSupply.class))),
            @ApiResponse(responseCode = "400", description = "Timestamp is not a valid unix time"),
            @ApiResponse(responseCode = "503", description = "Reconciliation failed")
    })
    @GetMapping("/global-state")
    public ResponseEntity<Object> getGlobalState(
            @Parameter(description = "Unix time in seconds; latest when omitted")
            @RequestParam(required = false) Long timestamp) {
        ReconciliationResult result = reconcile(timestamp);
        if (!result.isSuccess()) {
            return failure(result);
        }
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(result.getReconciledSupply());
    }

    private ResponseEntity<Object> respondWithAmount(Long timestamp,
                                                     Function<ReconciledSupply, BigDecimal> amount) {
        ReconciliationResult result = reconcile(timestamp);
        if (!result.isSuccess()) {
            return failure(result);
        }
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .body(amount.apply(result.getReconciledSupply()).toPlainString());
    }

    private ReconciliationResult reconcile(Long timestamp) {
        if (timestamp == null) {
            return reconciliationService.reconcileLatest();
        }
        if (timestamp <= 0) {
            throw new IllegalArgumentException("timestamp must be a positive unix time in seconds");
        }
        return reconciliationService.reconcileAtTimestamp(timestamp);
    }

    private ResponseEntity<Object> failure(ReconciliationResult result) {
        log.warn("Serving 503, reconciliation failed: {}", result.getErrors());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", FAILURE_MESSAGE);
        body.put("details", result.getErrors());
        body.put("circuitOpen", result.isCircuitOpen());
        body.put("timestamp", Instant.now(clock).toString());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
