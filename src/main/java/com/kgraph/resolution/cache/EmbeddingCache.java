package com.kgraph.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.kgraph.resolution.metrics.MetricsService;
import com.kgraph.resolution.metrics.NoOpMetricsService;
import com.kgraph.resolution.similarity.EmbeddingFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Caffeine-backed memoization of an {@link EmbeddingFunction}, keyed by the embedded text.
 * Itself an {@link EmbeddingFunction}, so it can be dropped in wherever one is expected.
 *
 * <p>Cached vectors never leave the cache: the delegate's result is copied on the way in and
 * every caller gets its own copy on the way out.</p>
 */
public class EmbeddingCache implements EmbeddingFunction {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingCache.class);

    private final EmbeddingFunction delegate;
    private final Cache<String, float[]> cache;
    private final MetricsService metricsService;

    public EmbeddingCache(EmbeddingFunction delegate) {
        this(delegate, CacheConfig.defaults(), new NoOpMetricsService());
    }

    public EmbeddingCache(EmbeddingFunction delegate, CacheConfig config, MetricsService metricsService) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("EmbeddingCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public float[] embed(String text) {
        boolean[] computed = {false};
        float[] vector = cache.get(text, key -> {
            computed[0] = true;
            float[] embedded = delegate.embed(key);
            return embedded != null ? embedded.clone() : null;
        });
        if (computed[0]) {
            metricsService.recordEmbeddingCacheMiss();
        } else {
            metricsService.recordEmbeddingCacheHit();
        }
        return vector != null ? vector.clone() : null;
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long missCount() {
        return cache.stats().missCount();
    }

    public long estimatedSize() {
        return cache.estimatedSize();
    }

    @Override
    public String toString() {
        CacheStats stats = cache.stats();
        return "EmbeddingCache{size=" + cache.estimatedSize() + ", hits=" + stats.hitCount()
                + ", misses=" + stats.missCount() + '}';
    }
}
