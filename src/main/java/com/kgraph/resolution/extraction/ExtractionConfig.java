package com.kgraph.resolution.extraction;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the {@link ExtractionGateway}.
 *
 * @param maxChunkChars      maximum characters per extractor call
 * @param maxConcurrency     number of extraction workers
 * @param chunkTimeout       wall-clock limit for one chunk, retries included
 * @param contextWindowChars characters of surrounding text kept on each side of a mention
 * @param chunkOverlapChars  characters a chunk cut inside a sentence shares with the next chunk
 */
public record ExtractionConfig(int maxChunkChars, int maxConcurrency, Duration chunkTimeout,
                               int contextWindowChars, int chunkOverlapChars) {

    public ExtractionConfig {
        if (maxChunkChars < 1) {
            throw new IllegalArgumentException("maxChunkChars must be >= 1");
        }
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1");
        }
        Objects.requireNonNull(chunkTimeout, "chunkTimeout is required");
        if (chunkTimeout.isZero() || chunkTimeout.isNegative()) {
            throw new IllegalArgumentException("chunkTimeout must be > 0");
        }
        if (contextWindowChars < 0) {
            throw new IllegalArgumentException("contextWindowChars must be >= 0");
        }
        if (chunkOverlapChars < 0 || chunkOverlapChars >= maxChunkChars) {
            throw new IllegalArgumentException("chunkOverlapChars must be in [0, maxChunkChars)");
        }
    }

    /**
     * Overlap defaults to half a chunk, at most 200 characters.
     */
    public ExtractionConfig(int maxChunkChars, int maxConcurrency, Duration chunkTimeout, int contextWindowChars) {
        this(maxChunkChars, maxConcurrency, chunkTimeout, contextWindowChars, Math.min(200, maxChunkChars / 2));
    }

    /**
     * Default configuration: 4,000-char chunks overlapping by 200, 4 workers, 60s per chunk, 64 chars of context.
     */
    public static ExtractionConfig defaults() {
        return new ExtractionConfig(4000, 4, Duration.ofSeconds(60), 64);
    }
}
