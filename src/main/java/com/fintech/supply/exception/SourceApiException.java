package com.fintech.supply.exception;

/**
 * Thrown when an upstream supply source (a subgraph or the block explorer)
 * cannot be reached or returns something unusable.
 * These are the errors the retry executor retries.
 */
public class SourceApiException extends ReconciliationException {

    private final String sourceName;

    public SourceApiException(String message, String sourceName) {
        super(message);
        this.sourceName = sourceName;
    }

    public SourceApiException(String message, String sourceName, Throwable cause) {
        super(message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
