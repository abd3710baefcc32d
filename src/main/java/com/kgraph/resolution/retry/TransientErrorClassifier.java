package com.kgraph.resolution.retry;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failure is worth retrying.
 * Walks the cause chain and accepts {@link TransientException}s, timeouts, and
 * failures whose message reads like a rate-limit or quota response.
 */
public final class TransientErrorClassifier {

    private static final List<String> RATE_LIMIT_INDICATORS = List.of(
            "429",
            "rate limit",
            "rate_limit",
            "ratelimit",
            "quota",
            "exhausted",
            "too many requests",
            "overloaded"
    );

    private TransientErrorClassifier() {
    }

    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof TransientException
                    || current instanceof TimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException) {
                return true;
            }
            if (isRateLimitMessage(current.getMessage())) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public static boolean isRateLimitMessage(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String indicator : RATE_LIMIT_INDICATORS) {
            if (lower.contains(indicator)) {
                return true;
            }
        }
        return false;
    }
}
