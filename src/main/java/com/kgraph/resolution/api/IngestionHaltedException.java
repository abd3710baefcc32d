package com.kgraph.resolution.api;

/**
 * Thrown by every ingestion after the registry was found corrupted. The pipeline must be rebuilt.
 */
public class IngestionHaltedException extends IllegalStateException {

    public IngestionHaltedException(String message, Throwable cause) {
        super(message, cause);
    }
}
