package com.fintech.supply;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Token Supply Reconciliation Service
 * <p>
 * Reports a single, deterministic view of token supply for a token that lives on
 * a layer one chain and a layer two rollup bridged to it.
 * <p>
 * Key Features:
 * - Parallel fetch of both ledgers with retry and per-operation circuit breakers
 * - Bridge-flow netting so bridged tokens are counted once
 * - Validation of raw and reconciled figures, all-or-nothing results
 * - Supply figures at a historical timestamp via block resolution
 */
@SpringBootApplication
public class SupplyReconciliationApplication {

    public static void main(String[] args) {
        SpringApplication.run(SupplyReconciliationApplication.class, args);
    }
}
