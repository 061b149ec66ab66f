package com.fintech.supply.service;

import com.fintech.supply.dto.LayerOneSupply;
import com.fintech.supply.exception.SourceApiException;

import java.util.Optional;

/**
 * Source of layer one supply facts.
 * <p>
 * The production implementation queries the layer one network subgraph;
 * tests substitute mocks.
 */
public interface LayerOneSupplyClient {

    /**
     * Fetches the most recent supply facts.
     *
     * @throws SourceApiException if the source is unavailable or returns no data
     */
    LayerOneSupply fetchLatest() throws SourceApiException;

    /**
     * Fetches supply facts as of a block.
     *
     * @return empty when the source has no state for that block
     * @throws SourceApiException if the source is unavailable or returns an error
     */
    Optional<LayerOneSupply> fetchAtBlock(long blockNumber) throws SourceApiException;

    /**
     * Returns the name of this source. Used for logging and health reporting.
     */
    String getSourceName();
}
