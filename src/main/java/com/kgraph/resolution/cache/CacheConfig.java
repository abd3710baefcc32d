package com.kgraph.resolution.cache;

/**
 * Configuration for the embedding cache.
 *
 * @param maxSize    maximum number of cached vectors
 * @param ttlSeconds time-to-live of each entry, in seconds
 */
public record CacheConfig(int maxSize, int ttlSeconds) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 10,000 entries, one hour TTL.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 3600);
    }
}
