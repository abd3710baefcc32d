package com.kgraph.resolution.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff with jitter for calls to external collaborators.
 * The delay before retry {@code n} (1-based) is
 * {@code min(maxDelay, baseDelay * multiplier^(n-1))} plus a uniform jitter in {@code [0, maxJitter)}.
 *
 * @param maxAttempts total number of attempts, including the first call
 * @param baseDelay   delay before the first retry
 * @param multiplier  growth factor between consecutive retries
 * @param maxDelay    cap on the exponential part of the delay
 * @param maxJitter   upper bound of the random jitter added to each delay
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay,
                          Duration maxJitter) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(baseDelay, "baseDelay is required");
        Objects.requireNonNull(maxDelay, "maxDelay is required");
        Objects.requireNonNull(maxJitter, "maxJitter is required");
        if (baseDelay.isNegative() || maxDelay.isNegative() || maxJitter.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * Default policy: 3 attempts, 200ms base delay, x2 growth, 10s cap, up to 100ms jitter.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(200), 2.0, Duration.ofSeconds(10), Duration.ofMillis(100));
    }

    /**
     * A policy that calls exactly once.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Delay to wait before the given retry.
     *
     * @param retry          1 for the first retry, 2 for the second, ...
     * @param jitterFraction a value in {@code [0, 1)} selecting the jitter
     */
    public Duration delayBefore(int retry, double jitterFraction) {
        double exponential = baseDelay.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
        long capped = (long) Math.min(maxDelay.toMillis(), exponential);
        long jitter = (long) (maxJitter.toMillis() * jitterFraction);
        return Duration.ofMillis(capped + jitter);
    }
}
