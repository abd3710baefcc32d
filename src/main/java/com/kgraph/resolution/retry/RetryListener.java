package com.kgraph.resolution.retry;

import java.time.Duration;

/**
 * Observes retries scheduled by a {@link Retrier}.
 */
@FunctionalInterface
public interface RetryListener {

    RetryListener NONE = (operation, attempt, maxAttempts, delay, cause) -> { };

    /**
     * Called before sleeping ahead of a retry.
     *
     * @param operation   name of the retried operation
     * @param attempt     the attempt that just failed (1-based)
     * @param maxAttempts the configured maximum
     * @param delay       how long the retrier waits before the next attempt
     * @param cause       the transient failure
     */
    void onRetry(String operation, int attempt, int maxAttempts, Duration delay, Throwable cause);
}
