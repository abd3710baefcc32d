package com.kgraph.resolution.retry;

/**
 * Base class for failures of an external collaborator that may succeed when retried
 * (rate limits, timeouts, temporarily unavailable services).
 */
public class TransientException extends RuntimeException {

    public TransientException(String message) {
        super(message);
    }

    public TransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
