package com.fintech.supply.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Supply facts reported by the layer one network subgraph.
 * <p>
 * All amounts are integer strings in smallest units (10^18 per token),
 * exactly as returned upstream.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LayerOneSupply {

    /**
     * Every token ever minted on layer one, including tokens bridged out.
     */
    String totalSupply;

    /**
     * Tokens locked in vesting contracts.
     */
    String lockedSupply;

    /**
     * Locked supply baseline at protocol genesis.
     */
    String lockedSupplyGenesis;

    /**
     * Tokens not locked: totalSupply - lockedSupply.
     */
    String liquidSupply;

    /**
     * Tokens actively circulating on layer one.
     */
    String circulatingSupply;
}
