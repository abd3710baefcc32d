package com.kgraph.resolution.graph;

/**
 * A graph store write failed for good (retries exhausted or a permanent error).
 * The registry is unaffected; the graph lags behind it until the write is repeated.
 */
public class GraphWriteException extends RuntimeException {

    private final String operation;

    public GraphWriteException(String operation, Throwable cause) {
        super("Graph write failed: " + operation + (cause != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
