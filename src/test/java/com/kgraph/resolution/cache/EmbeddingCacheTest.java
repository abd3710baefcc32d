package com.kgraph.resolution.cache;

import com.kgraph.resolution.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingCache Tests")
class EmbeddingCacheTest {

    @Mock
    private MetricsService metricsService;

    private final AtomicInteger delegateCalls = new AtomicInteger();
    private EmbeddingCache cache;

    @BeforeEach
    void setUp() {
        cache = new EmbeddingCache(text -> {
            delegateCalls.incrementAndGet();
            return new float[]{text.length(), 1f};
        }, new CacheConfig(100, 60), metricsService);
    }

    @Test
    @DisplayName("Should call the delegate once per distinct text")
    void cachesVectors() {
        float[] first = cache.embed("Apple Inc.");
        float[] second = cache.embed("Apple Inc.");
        cache.embed("Tim Cook");

        assertArrayEquals(first, second);
        assertEquals(2, delegateCalls.get());
        assertEquals(2, cache.estimatedSize());
        assertEquals(1, cache.hitCount());
        assertEquals(2, cache.missCount());
    }

    @Test
    @DisplayName("Mutating a returned vector should not change the cached one")
    void returnsCopies() {
        float[] first = cache.embed("Apple Inc.");
        float[] expected = first.clone();

        first[0] = 42f;
        float[] second = cache.embed("Apple Inc.");

        assertNotSame(first, second);
        assertArrayEquals(expected, second);
        assertEquals(1, delegateCalls.get());
    }

    @Test
    @DisplayName("Should report hits and misses to metrics")
    void reportsMetrics() {
        cache.embed("Apple");
        cache.embed("Apple");
        cache.embed("Apple");

        verify(metricsService, times(1)).recordEmbeddingCacheMiss();
        verify(metricsService, times(2)).recordEmbeddingCacheHit();
    }

    @Test
    @DisplayName("invalidateAll should force recomputation")
    void invalidateAll() {
        cache.embed("Apple");
        cache.invalidateAll();
        cache.embed("Apple");

        assertEquals(2, delegateCalls.get());
    }

    @Test
    @DisplayName("Should reject invalid configuration")
    void configValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60));
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0));
        assertEquals(10_000, CacheConfig.defaults().maxSize());
    }
}
