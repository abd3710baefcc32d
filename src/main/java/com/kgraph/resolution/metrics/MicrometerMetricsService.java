package com.kgraph.resolution.metrics;

import com.kgraph.resolution.core.model.DecisionTier;
import com.kgraph.resolution.core.model.EntityType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code kgraph.extraction.chunk.duration}: Timer (tag: status)</li>
 *   <li>{@code kgraph.ingestion.duration}: Timer</li>
 *   <li>{@code kgraph.mentions.extracted}, {@code kgraph.mentions.replayed},
 *       {@code kgraph.mentions.malformed}: Counters</li>
 *   <li>{@code kgraph.entity.created}: Counter (tag: entityType)</li>
 *   <li>{@code kgraph.entity.merged}: Counter (tags: entityType, tier)</li>
 *   <li>{@code kgraph.entity.type_conflict}: Counter (tag: entityType)</li>
 *   <li>{@code kgraph.retry}: Counter (tag: operation)</li>
 *   <li>{@code kgraph.similarity.score}: DistributionSummary</li>
 *   <li>{@code kgraph.embedding.cache.hit} / {@code .miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer ingestionTimer;
    private final Counter mentionsExtracted;
    private final Counter mentionsReplayed;
    private final Counter mentionsMalformed;
    private final DistributionSummary similarityScoreSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.ingestionTimer = Timer.builder("kgraph.ingestion.duration")
                .description("Duration of document ingestion")
                .register(registry);
        this.mentionsExtracted = Counter.builder("kgraph.mentions.extracted")
                .description("Number of mentions returned by the extractor")
                .register(registry);
        this.mentionsReplayed = Counter.builder("kgraph.mentions.replayed")
                .description("Number of mentions already applied and skipped")
                .register(registry);
        this.mentionsMalformed = Counter.builder("kgraph.mentions.malformed")
                .description("Number of mentions rejected by the normalizer")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("kgraph.similarity.score")
                .description("Distribution of best similarity scores per candidate")
                .register(registry);
        this.cacheHitCounter = Counter.builder("kgraph.embedding.cache.hit")
                .description("Number of embedding cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("kgraph.embedding.cache.miss")
                .description("Number of embedding cache misses")
                .register(registry);
    }

    @Override
    public void recordChunkExtraction(String status, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(status, k ->
                Timer.builder("kgraph.extraction.chunk.duration")
                        .description("Duration of chunk extraction calls")
                        .tag("status", status)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordIngestionDuration(Duration duration) {
        ingestionTimer.record(duration);
    }

    @Override
    public void incrementMentionsExtracted(int count) {
        mentionsExtracted.increment(count);
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
        counter("created:" + type.name(), () -> Counter.builder("kgraph.entity.created")
                .description("Number of canonical entities created")
                .tag("entityType", type.name())).increment();
    }

    @Override
    public void incrementEntityMerged(EntityType type, DecisionTier tier) {
        counter("merged:" + type.name() + ":" + tier.name(), () -> Counter.builder("kgraph.entity.merged")
                .description("Number of mentions merged into an existing entity")
                .tag("entityType", type.name())
                .tag("tier", tier.name())).increment();
    }

    @Override
    public void incrementMentionReplayed() {
        mentionsReplayed.increment();
    }

    @Override
    public void incrementMentionMalformed() {
        mentionsMalformed.increment();
    }

    @Override
    public void incrementTypeConflict(EntityType type) {
        counter("conflict:" + type.name(), () -> Counter.builder("kgraph.entity.type_conflict")
                .description("Number of exact-key matches refused because of a type mismatch")
                .tag("entityType", type.name())).increment();
    }

    @Override
    public void incrementRetry(String operation) {
        counter("retry:" + operation, () -> Counter.builder("kgraph.retry")
                .description("Number of retried calls")
                .tag("operation", operation)).increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordEmbeddingCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordEmbeddingCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String key, Supplier<Counter.Builder> builder) {
        return counterCache.computeIfAbsent(key, k -> builder.get().register(registry));
    }
}
