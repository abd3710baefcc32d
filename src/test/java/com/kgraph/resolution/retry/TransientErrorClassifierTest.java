package com.kgraph.resolution.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransientErrorClassifier Tests")
class TransientErrorClassifierTest {

    @Test
    @DisplayName("TransientException and timeouts should be transient")
    void transientTypes() {
        assertTrue(TransientErrorClassifier.isTransient(new TransientException("unavailable")));
        assertTrue(TransientErrorClassifier.isTransient(new TimeoutException()));
        assertTrue(TransientErrorClassifier.isTransient(new SocketTimeoutException("read timed out")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "HTTP 429",
            "Rate limit reached for requests",
            "RESOURCE_EXHAUSTED",
            "You exceeded your current quota",
            "Too Many Requests",
            "Model is overloaded"
    })
    @DisplayName("Rate-limit messages should be transient")
    void rateLimitMessages(String message) {
        assertTrue(TransientErrorClassifier.isTransient(new RuntimeException(message)));
    }

    @Test
    @DisplayName("Should find a transient failure in the cause chain")
    void walksCauseChain() {
        Exception wrapped = new IllegalStateException("call failed",
                new IOException("io", new TransientException("busy")));
        assertTrue(TransientErrorClassifier.isTransient(wrapped));
    }

    @Test
    @DisplayName("Other failures should be permanent")
    void permanentFailures() {
        assertFalse(TransientErrorClassifier.isTransient(new IllegalArgumentException("bad input")));
        assertFalse(TransientErrorClassifier.isTransient(new RuntimeException((String) null)));
        assertFalse(TransientErrorClassifier.isTransient(null));
    }
}
