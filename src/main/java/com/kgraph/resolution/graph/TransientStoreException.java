package com.kgraph.resolution.graph;

import com.kgraph.resolution.retry.TransientException;

/**
 * The graph store could not be reached; the write may succeed when retried.
 */
public class TransientStoreException extends TransientException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
