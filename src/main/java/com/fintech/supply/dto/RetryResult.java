package com.fintech.supply.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an operation run through the retry executor.
 */
@Value
@Builder
public class RetryResult<T> {

    boolean success;
    T data;
    String error;
    int attemptsMade;
    long totalDurationMs;

    /**
     * True when the call was rejected without any attempt.
     */
    boolean circuitOpen;

    public static <T> RetryResult<T> success(T data, int attemptsMade, long totalDurationMs) {
        return RetryResult.<T>builder()
                .success(true)
                .data(data)
                .attemptsMade(attemptsMade)
                .totalDurationMs(totalDurationMs)
                .build();
    }

    public static <T> RetryResult<T> failure(String error, int attemptsMade, long totalDurationMs) {
        return RetryResult.<T>builder()
                .success(false)
                .error(error)
                .attemptsMade(attemptsMade)
                .totalDurationMs(totalDurationMs)
                .build();
    }

    public static <T> RetryResult<T> circuitOpen(String error, long totalDurationMs) {
        return RetryResult.<T>builder()
                .success(false)
                .error(error)
                .attemptsMade(0)
                .totalDurationMs(totalDurationMs)
                .circuitOpen(true)
                .build();
    }
}
