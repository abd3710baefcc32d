package com.kgraph.resolution.api;

import com.kgraph.resolution.audit.DecisionLog;
import com.kgraph.resolution.cache.CacheConfig;
import com.kgraph.resolution.cache.EmbeddingCache;
import com.kgraph.resolution.core.model.Candidate;
import com.kgraph.resolution.core.model.CanonicalEntity;
import com.kgraph.resolution.core.model.DecisionTier;
import com.kgraph.resolution.core.model.RawMention;
import com.kgraph.resolution.core.model.Relation;
import com.kgraph.resolution.extraction.ChunkOutcome;
import com.kgraph.resolution.extraction.ExtractionCapability;
import com.kgraph.resolution.extraction.ExtractionConfig;
import com.kgraph.resolution.extraction.ExtractionGateway;
import com.kgraph.resolution.extraction.MentionRelation;
import com.kgraph.resolution.graph.GraphBuilder;
import com.kgraph.resolution.graph.GraphStore;
import com.kgraph.resolution.graph.GraphWriteException;
import com.kgraph.resolution.graph.InMemoryGraphStore;
import com.kgraph.resolution.logging.LogContext;
import com.kgraph.resolution.merge.ApplyOutcome;
import com.kgraph.resolution.merge.EntityRegistry;
import com.kgraph.resolution.merge.LaneConfig;
import com.kgraph.resolution.merge.MergeEngine;
import com.kgraph.resolution.merge.MergeLanes;
import com.kgraph.resolution.merge.RegistryCorruptionException;
import com.kgraph.resolution.metrics.MetricsService;
import com.kgraph.resolution.metrics.NoOpMetricsService;
import com.kgraph.resolution.retry.Retrier;
import com.kgraph.resolution.retry.RetryPolicy;
import com.kgraph.resolution.review.InMemoryReviewQueue;
import com.kgraph.resolution.review.ReviewQueue;
import com.kgraph.resolution.review.ReviewService;
import com.kgraph.resolution.rules.CandidateNormalizer;
import com.kgraph.resolution.rules.MalformedMentionException;
import com.kgraph.resolution.search.DocumentHit;
import com.kgraph.resolution.search.HybridSearchService;
import com.kgraph.resolution.search.SearchHit;
import com.kgraph.resolution.search.SearchOptions;
import com.kgraph.resolution.similarity.BlockingKeyStrategy;
import com.kgraph.resolution.similarity.CompositeSimilarityScorer;
import com.kgraph.resolution.similarity.EmbeddingFunction;
import com.kgraph.resolution.similarity.ResolutionOptions;
import com.kgraph.resolution.similarity.SimilarityResolver;
import com.kgraph.resolution.similarity.TokenPrefixBlockingKeyStrategy;
import com.kgraph.resolution.tracing.NoOpTracingService;
import com.kgraph.resolution.tracing.TraceSpan;
import com.kgraph.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main entry point: ingests documents into a deduplicated knowledge graph and searches it.
 *
 * <p>A document is split into chunks and extracted in parallel. As each chunk completes, its
 * mentions are normalized, resolved and applied on the registry lanes, the touched entities are
 * materialized into the graph store, and the chunk's relations follow. Failures that only affect
 * part of a document (a failed chunk, a malformed mention, a graph write) are recorded in the
 * {@link IngestionReport}. A corrupted registry halts the pipeline for good.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (KnowledgeGraphPipeline pipeline = KnowledgeGraphPipeline.builder()
 *         .extractionCapability(HttpExtractionClient.builder().baseUrl("http://extractor:6971").build())
 *         .graphStore(new FalkorDbGraphStore(new FalkorDBConnection("localhost", 6379, "kg")))
 *         .build()) {
 *
 *     IngestionReport report = pipeline.ingest("doc-1", text);
 *     List&lt;SearchHit&gt; hits = pipeline.search("tim cook", 10, 2);
 * }
 * </pre>
 */
public class KnowledgeGraphPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphPipeline.class);

    private final ExtractionGateway extractionGateway;
    private final CandidateNormalizer normalizer;
    private final MergeEngine mergeEngine;
    private final EntityRegistry registry;
    private final GraphBuilder graphBuilder;
    private final HybridSearchService searchService;
    private final ReviewService reviewService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ExecutorService ingestExecutor;
    private final AtomicReference<RegistryCorruptionException> haltCause = new AtomicReference<>();

    private KnowledgeGraphPipeline(Builder builder) {
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        RetryPolicy retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.defaults();
        Retrier retrier = new Retrier(retryPolicy,
                (operation, attempt, maxAttempts, delay, cause) -> metricsService.incrementRetry(operationName(operation)));

        this.extractionGateway = new ExtractionGateway(
                Objects.requireNonNull(builder.extractionCapability, "extractionCapability is required"),
                builder.extractionConfig != null ? builder.extractionConfig : ExtractionConfig.defaults(),
                retrier, metricsService, tracingService);
        this.normalizer = builder.normalizer != null ? builder.normalizer : new CandidateNormalizer();

        EmbeddingFunction embeddings = builder.embeddingFunction != null
                ? new EmbeddingCache(builder.embeddingFunction,
                builder.cacheConfig != null ? builder.cacheConfig : CacheConfig.defaults(), metricsService)
                : null;
        ResolutionOptions options = builder.resolutionOptions != null
                ? builder.resolutionOptions : ResolutionOptions.defaults();
        BlockingKeyStrategy blocking = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy : new TokenPrefixBlockingKeyStrategy();
        SimilarityResolver resolver = new SimilarityResolver(
                new CompositeSimilarityScorer(options.effectiveWeights(embeddings != null), embeddings),
                blocking, options, metricsService);

        this.mergeEngine = new MergeEngine(
                builder.decisionLog != null ? builder.decisionLog : new DecisionLog(), metricsService);
        this.registry = new EntityRegistry(mergeEngine, resolver,
                new MergeLanes(builder.laneConfig != null ? builder.laneConfig : LaneConfig.defaults()));

        GraphStore graphStore = builder.graphStore != null ? builder.graphStore : new InMemoryGraphStore();
        this.graphBuilder = new GraphBuilder(graphStore, mergeEngine, retrier);
        mergeEngine.addMergeListener(graphBuilder);

        this.searchService = HybridSearchService.builder()
                .registry(mergeEngine)
                .graphStore(graphStore)
                .embeddingFunction(embeddings)
                .normalizer(normalizer)
                .options(builder.searchOptions)
                .tracingService(tracingService)
                .build();

        ReviewQueue reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.reviewService = new ReviewService(reviewQueue, mergeEngine);

        AtomicInteger threadCounter = new AtomicInteger();
        this.ingestExecutor = Executors.newFixedThreadPool(builder.ingestConcurrency, runnable -> {
            Thread thread = new Thread(runnable, "kgraph-ingest-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        log.info("KnowledgeGraphPipeline initialized: graphStore={} embeddings={} ingestConcurrency={}",
                graphStore.getClass().getSimpleName(), embeddings != null, builder.ingestConcurrency);
    }

    // ========== Ingestion API ==========

    /**
     * Ingests one document. Re-ingesting a document is safe: mentions already applied are
     * replayed without changing any entity.
     *
     * @throws IngestionHaltedException if the registry was found corrupted by this or an earlier ingestion
     */
    public IngestionReport ingest(String documentId, String text) {
        Objects.requireNonNull(documentId, "documentId is required");
        checkNotHalted();
        String correlationId = LogContext.generateCorrelationId();
        long startNanos = System.nanoTime();
        IngestionReport.Builder report = IngestionReport.builder(documentId);

        try (LogContext ctx = LogContext.forIngestion(correlationId, documentId);
             TraceSpan span = tracingService.startSpan("ingest")) {
            span.setAttribute("documentId", documentId);
            log.info("ingest.started documentId={} textLength={}", documentId, text != null ? text.length() : 0);
            try {
                int unfinished = graphBuilder.repairUnions();
                if (unfinished > 0) {
                    log.warn("ingest.unions_unrepaired count={}", unfinished);
                }
                int chunks = extractionGateway.extract(documentId, text, outcome -> processChunk(outcome, report));
                report.chunksTotal(chunks);
            } catch (RegistryCorruptionException e) {
                halt(e);
                span.recordException(e);
                span.setStatus(TraceSpan.Status.ERROR);
                throw e;
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            IngestionReport result = report.duration(duration).build();
            metricsService.recordIngestionDuration(duration);
            span.setAttribute("mentions", result.getMentionsExtracted());
            span.setAttribute("chunksFailed", result.getChunksFailed());
            span.setStatus(TraceSpan.Status.OK);
            log.info("ingest.completed documentId={} chunks={} chunksFailed={} mentions={} merged={} created={} "
                            + "replayed={} malformed={} relations={} pending={} partial={} durationMs={}",
                    documentId, result.getChunksTotal(), result.getChunksFailed(), result.getMentionsExtracted(),
                    result.getMentionsMerged(), result.getMentionsCreated(), result.getMentionsReplayed(),
                    result.getMentionsMalformed(), result.getRelationsMaterialized(), result.getRelationsPending(),
                    result.isPartiallyMaterialized(), duration.toMillis());
            return result;
        }
    }

    /**
     * Ingests a document on the pipeline's ingestion pool.
     */
    public CompletableFuture<IngestionReport> ingestAsync(String documentId, String text) {
        return CompletableFuture.supplyAsync(() -> ingest(documentId, text), ingestExecutor);
    }

    private void processChunk(ChunkOutcome outcome, IngestionReport.Builder report) {
        if (!outcome.isSuccess()) {
            report.chunkFailed().error(IngestionError.Kind.EXTRACTION_FAILED,
                    "chunk " + outcome.chunkIndex() + " " + outcome.status() + ": " + outcome.error());
            return;
        }
        report.mentionsExtracted(outcome.mentions().size());
        metricsService.incrementMentionsExtracted(outcome.mentions().size());

        List<CompletableFuture<ApplyOutcome>> pending = new ArrayList<>(outcome.mentions().size());
        List<String> mentionIds = new ArrayList<>(outcome.mentions().size());
        for (RawMention mention : outcome.mentions()) {
            try {
                Candidate candidate = normalizer.normalize(mention);
                pending.add(registry.submit(candidate));
                mentionIds.add(mention.mentionId());
            } catch (MalformedMentionException e) {
                log.warn("ingest.mention_malformed mentionId={} reason={}", e.getMentionId(), e.getMessage());
                metricsService.incrementMentionMalformed();
                report.mentionMalformed().error(IngestionError.Kind.MALFORMED_MENTION, e.getMessage());
            }
        }

        for (int i = 0; i < pending.size(); i++) {
            ApplyOutcome applied = await(pending.get(i), mentionIds.get(i), report);
            if (applied != null) {
                record(applied, report);
                materialize(applied.entityId(), report);
            }
        }

        for (MentionRelation relation : outcome.relations()) {
            materialize(relation, report);
        }
    }

    private ApplyOutcome await(CompletableFuture<ApplyOutcome> future, String mentionId,
                               IngestionReport.Builder report) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while resolving mention " + mentionId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                    ? e.getCause().getCause() : e.getCause();
            if (cause instanceof RegistryCorruptionException corruption) {
                throw corruption;
            }
            log.error("ingest.resolution_failed mentionId={} error={}", mentionId, cause.getMessage(), cause);
            report.error(IngestionError.Kind.RESOLUTION_FAILED, mentionId + ": " + cause.getMessage());
            return null;
        }
    }

    private void record(ApplyOutcome applied, IngestionReport.Builder report) {
        switch (applied.kind()) {
            case REPLAYED -> report.mentionReplayed();
            case MERGED -> report.mentionMerged();
            case CREATED -> report.mentionCreated();
        }
        if (applied.tier() == DecisionTier.TYPE_CONFLICT) {
            report.typeConflict();
        } else if (applied.tier() == DecisionTier.LOW_CONFIDENCE) {
            report.lowConfidenceMerge();
        }
        reviewService.flag(applied);
    }

    private void materialize(int entityId, IngestionReport.Builder report) {
        Optional<CanonicalEntity> entity = mergeEngine.getEntity(entityId);
        if (entity.isEmpty()) {
            return;
        }
        try {
            graphBuilder.materialize(entity.get());
        } catch (GraphWriteException e) {
            log.warn("ingest.graph_write_failed entityId={} error={}", entityId, e.getMessage());
            report.partiallyMaterialized().error(IngestionError.Kind.GRAPH_WRITE_FAILED,
                    "entity " + entityId + ": " + e.getMessage());
        }
    }

    private void materialize(MentionRelation mentionRelation, IngestionReport.Builder report) {
        Optional<Integer> subject = mergeEngine.rootOfMention(mentionRelation.subjectMentionId());
        Optional<Integer> object = mergeEngine.rootOfMention(mentionRelation.objectMentionId());
        if (subject.isEmpty() || object.isEmpty()) {
            report.error(IngestionError.Kind.RELATION_DROPPED, mentionRelation + ": endpoint mention not resolved");
            return;
        }
        Relation relation;
        try {
            relation = new Relation(subject.get(), Relation.toPredicate(mentionRelation.predicate()), object.get(),
                    Set.of(mentionRelation.subjectMentionId(), mentionRelation.objectMentionId()));
        } catch (IllegalArgumentException e) {
            report.error(IngestionError.Kind.RELATION_DROPPED, mentionRelation + ": " + e.getMessage());
            return;
        }
        try {
            switch (graphBuilder.materialize(relation)) {
                case MATERIALIZED -> report.relationMaterialized();
                case PENDING -> report.relationPending();
                default -> log.trace("ingest.relation_unchanged edge={}", relation.edgeKey());
            }
        } catch (GraphWriteException e) {
            log.warn("ingest.graph_write_failed edge={} error={}", relation.edgeKey(), e.getMessage());
            report.partiallyMaterialized().error(IngestionError.Kind.GRAPH_WRITE_FAILED,
                    relation.edgeKey() + ": " + e.getMessage());
        }
    }

    private void checkNotHalted() {
        // corruption can also surface outside ingestion, e.g. while a review approval merges entities
        mergeEngine.getCorruption().ifPresent(this::halt);
        RegistryCorruptionException cause = haltCause.get();
        if (cause != null) {
            throw new IngestionHaltedException("Ingestion halted after registry corruption: " + cause.getMessage(),
                    cause);
        }
    }

    private void halt(RegistryCorruptionException e) {
        if (haltCause.compareAndSet(null, e)) {
            log.error("ingest.halted reason={}", e.getMessage(), e);
        }
    }

    public boolean isHalted() {
        return haltCause.get() != null || mergeEngine.getCorruption().isPresent();
    }

    // ========== Query API ==========

    /**
     * Ranked entities for a free-text query, expanded through the graph by up to {@code exploreDepth} hops.
     */
    public List<SearchHit> search(String queryText, int limit, int exploreDepth) {
        return searchService.query(queryText, limit, exploreDepth);
    }

    /**
     * Like {@link #search(String, int, int)}, moving hits whose aliases match one of {@code boostKeywords} up.
     */
    public List<SearchHit> search(String queryText, int limit, int exploreDepth, Collection<String> boostKeywords) {
        return searchService.query(queryText, limit, exploreDepth, boostKeywords);
    }

    /**
     * Ranked documents for a free-text query.
     */
    public List<DocumentHit> searchDocuments(String queryText, int limit, int exploreDepth) {
        return searchService.queryDocuments(queryText, limit, exploreDepth);
    }

    /**
     * The canonical entity a mention resolved to, through the current root.
     */
    public Optional<CanonicalEntity> lookup(String mentionId) {
        return registry.lookup(mentionId);
    }

    public Optional<CanonicalEntity> getEntity(int entityId) {
        return registry.getEntity(entityId);
    }

    public List<CanonicalEntity> getEntities() {
        return registry.getEntities();
    }

    public DecisionLog getDecisionLog() {
        return mergeEngine.getDecisionLog();
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public GraphBuilder getGraphBuilder() {
        return graphBuilder;
    }

    public MergeEngine getMergeEngine() {
        return mergeEngine;
    }

    @Override
    public void close() {
        ingestExecutor.shutdown();
        try {
            if (!ingestExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                ingestExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ingestExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        extractionGateway.close();
        registry.close();
        log.info("KnowledgeGraphPipeline closed");
    }

    private static String operationName(String operation) {
        int space = operation.indexOf(' ');
        return space > 0 ? operation.substring(0, space) : operation;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ExtractionCapability extractionCapability;
        private ExtractionConfig extractionConfig;
        private RetryPolicy retryPolicy;
        private CandidateNormalizer normalizer;
        private ResolutionOptions resolutionOptions;
        private BlockingKeyStrategy blockingKeyStrategy;
        private EmbeddingFunction embeddingFunction;
        private CacheConfig cacheConfig;
        private LaneConfig laneConfig;
        private DecisionLog decisionLog;
        private GraphStore graphStore;
        private SearchOptions searchOptions;
        private ReviewQueue reviewQueue;
        private MetricsService metricsService;
        private TracingService tracingService;
        private int ingestConcurrency = 2;

        public Builder extractionCapability(ExtractionCapability extractionCapability) {
            this.extractionCapability = extractionCapability;
            return this;
        }

        public Builder extractionConfig(ExtractionConfig extractionConfig) {
            this.extractionConfig = extractionConfig;
            return this;
        }

        /**
         * Retry policy for extraction calls and graph store writes.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder normalizer(CandidateNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder resolutionOptions(ResolutionOptions resolutionOptions) {
            this.resolutionOptions = resolutionOptions;
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        /**
         * Enables vector search and embedding similarity during resolution. Unless the resolution
         * options set weights explicitly, mentions are then scored with
         * {@link com.kgraph.resolution.similarity.SimilarityWeights#withEmbeddings()}.
         * The function is wrapped in an {@link EmbeddingCache}.
         */
        public Builder embeddingFunction(EmbeddingFunction embeddingFunction) {
            this.embeddingFunction = embeddingFunction;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder laneConfig(LaneConfig laneConfig) {
            this.laneConfig = laneConfig;
            return this;
        }

        public Builder decisionLog(DecisionLog decisionLog) {
            this.decisionLog = decisionLog;
            return this;
        }

        public Builder graphStore(GraphStore graphStore) {
            this.graphStore = graphStore;
            return this;
        }

        public Builder searchOptions(SearchOptions searchOptions) {
            this.searchOptions = searchOptions;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Number of documents {@link #ingestAsync} ingests at once. Default 2.
         */
        public Builder ingestConcurrency(int ingestConcurrency) {
            if (ingestConcurrency < 1) {
                throw new IllegalArgumentException("ingestConcurrency must be at least 1");
            }
            this.ingestConcurrency = ingestConcurrency;
            return this;
        }

        public KnowledgeGraphPipeline build() {
            return new KnowledgeGraphPipeline(this);
        }
    }
}
