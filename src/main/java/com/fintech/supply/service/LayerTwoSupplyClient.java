package com.fintech.supply.service;

import com.fintech.supply.dto.LayerTwoSupply;
import com.fintech.supply.exception.SourceApiException;

import java.util.Optional;

/**
 * Source of layer two supply facts, queried at a configurable endpoint.
 */
public interface LayerTwoSupplyClient {

    /**
     * @param endpoint the layer two subgraph URL
     * @throws SourceApiException if the source is unavailable or returns no data
     */
    LayerTwoSupply fetchLatest(String endpoint) throws SourceApiException;

    /**
     * @return empty when the source has no state for that block
     * @throws SourceApiException if the source is unavailable or returns an error
     */
    Optional<LayerTwoSupply> fetchAtBlock(long blockNumber, String endpoint) throws SourceApiException;

    String getSourceName();
}
