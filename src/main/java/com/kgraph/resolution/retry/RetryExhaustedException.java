package com.kgraph.resolution.retry;

/**
 * Thrown when a call kept failing transiently until the retry policy ran out of attempts.
 * The cause is the last failure.
 */
public class RetryExhaustedException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable cause) {
        super("Operation '" + operation + "' failed after " + attempts + " attempt(s): "
                + (cause != null ? cause.getMessage() : "unknown"), cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
