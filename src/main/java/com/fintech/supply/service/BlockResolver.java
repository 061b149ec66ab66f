package com.fintech.supply.service;

import com.fintech.supply.exception.SourceApiException;

import java.util.Optional;

/**
 * Maps wall-clock time to layer one block numbers.
 */
public interface BlockResolver {

    /**
     * Finds the last block produced at or before {@code timestampSeconds}.
     *
     * @return empty when no block could be resolved; callers fall back to the latest block
     */
    Optional<Long> resolveBlockForTimestamp(long timestampSeconds, String apiKey);

    /**
     * @throws SourceApiException when the latest block cannot be determined
     */
    long resolveLatestBlock(String apiKey) throws SourceApiException;
}
