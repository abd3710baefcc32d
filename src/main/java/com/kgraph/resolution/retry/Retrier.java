package com.kgraph.resolution.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Runs a call under a {@link RetryPolicy}.
 *
 * <p>Only failures accepted by the classifier (by default {@link TransientErrorClassifier})
 * are retried; any other failure propagates immediately. When the attempts run out a
 * {@link RetryExhaustedException} carrying the last failure is thrown.</p>
 */
public class Retrier {
    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    /**
     * Blocks the calling thread between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final RetryPolicy policy;
    private final Predicate<Throwable> transientClassifier;
    private final RetryListener listener;
    private final Sleeper sleeper;

    public Retrier(RetryPolicy policy) {
        this(policy, TransientErrorClassifier::isTransient, RetryListener.NONE,
                duration -> Thread.sleep(duration.toMillis()));
    }

    public Retrier(RetryPolicy policy, RetryListener listener) {
        this(policy, TransientErrorClassifier::isTransient, listener,
                duration -> Thread.sleep(duration.toMillis()));
    }

    public Retrier(RetryPolicy policy, Predicate<Throwable> transientClassifier,
                   RetryListener listener, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.transientClassifier = Objects.requireNonNull(transientClassifier, "transientClassifier is required");
        this.listener = listener != null ? listener : RetryListener.NONE;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    /**
     * Calls {@code action} until it succeeds, fails permanently, or the policy is exhausted.
     *
     * @param operation name used in logs and listener notifications
     * @param action    the call to make
     * @return the action's result
     * @throws RetryExhaustedException when every attempt failed transiently
     */
    public <T> T call(String operation, Supplier<T> action) {
        int maxAttempts = policy.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!transientClassifier.test(e)) {
                    log.debug("retry.permanent_failure operation={} attempt={} error={}",
                            operation, attempt, e.getMessage());
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("retry.exhausted operation={} attempts={} error={}",
                            operation, attempt, e.getMessage());
                    throw new RetryExhaustedException(operation, attempt, e);
                }
                Duration delay = policy.delayBefore(attempt, ThreadLocalRandom.current().nextDouble());
                log.info("retry.scheduled operation={} attempt={}/{} delayMs={} error={}",
                        operation, attempt, maxAttempts, delay.toMillis(), e.getMessage());
                notifyListener(operation, attempt, maxAttempts, delay, e);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RetryExhaustedException(operation, attempt, ie);
                }
            }
        }
    }

    /**
     * Runs {@code action} under the policy.
     */
    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private void notifyListener(String operation, int attempt, int maxAttempts, Duration delay, Throwable cause) {
        try {
            listener.onRetry(operation, attempt, maxAttempts, delay, cause);
        } catch (Exception e) {
            log.warn("Retry listener failed for {}: {}", operation, e.getMessage());
        }
    }
}
