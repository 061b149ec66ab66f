package com.fintech.supply.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Unified token supply across both layers, in whole tokens.
 * <p>
 * Relationships that hold for every successful reconciliation:
 * <ul>
 *   <li>totalSupply = liquidSupply + lockedSupply</li>
 *   <li>circulatingSupply &lt;= totalSupply</li>
 * </ul>
 */
@Value
@Builder(toBuilder = true)
public class ReconciledSupply {

    /**
     * Layer one total plus layer two net supply.
     */
    BigDecimal totalSupply;

    /**
     * Layer one locked supply. Layer two has no locking primitive.
     */
    BigDecimal lockedSupply;

    BigDecimal lockedSupplyGenesis;

    /**
     * totalSupply - lockedSupply.
     */
    BigDecimal liquidSupply;

    /**
     * Layer one circulating supply plus layer two net supply.
     */
    BigDecimal circulatingSupply;

    /**
     * Source facts, kept verbatim for transparency.
     */
    LayerOneSupply l1Breakdown;

    LayerTwoSupply l2Breakdown;

    Instant reconciliationTimestamp;
}
