package com.kgraph.resolution.extraction;

import com.kgraph.resolution.retry.TransientException;

/**
 * Thrown by an extraction capability when a call failed but may succeed if retried.
 */
public class TransientExtractionException extends TransientException {

    public TransientExtractionException(String message) {
        super(message);
    }

    public TransientExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
