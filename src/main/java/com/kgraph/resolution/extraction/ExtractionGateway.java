package com.kgraph.resolution.extraction;

import com.kgraph.resolution.core.model.RawMention;
import com.kgraph.resolution.logging.LogContext;
import com.kgraph.resolution.metrics.MetricsService;
import com.kgraph.resolution.metrics.NoOpMetricsService;
import com.kgraph.resolution.retry.Retrier;
import com.kgraph.resolution.retry.RetryPolicy;
import com.kgraph.resolution.tracing.NoOpTracingService;
import com.kgraph.resolution.tracing.TraceSpan;
import com.kgraph.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs the extraction capability over a document, chunk by chunk, on a fixed pool of workers.
 *
 * <p>Each chunk call is retried through the {@link Retrier}; a chunk that exhausts its retries
 * or fails permanently is reported as {@link ChunkStatus#FAILED} and the other chunks carry on.
 * A chunk still running when {@code chunkTimeout} elapses is cancelled, its mentions are
 * discarded and it is reported as {@link ChunkStatus#TIMED_OUT}.</p>
 *
 * <p>Chunks cut inside a sentence overlap the next chunk. A mention starting in the overlap is
 * kept only from the later chunk, so each span is reported once per document.</p>
 *
 * <p>Outcomes are delivered in completion order, not chunk order.</p>
 */
public class ExtractionGateway implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExtractionGateway.class);

    static final String UNAVAILABLE = "extraction service unavailable";

    private final ExtractionCapability capability;
    private final ExtractionConfig config;
    private final TextChunker chunker;
    private final Retrier retrier;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ExecutorService workers;
    private final ScheduledExecutorService timeouts;

    public ExtractionGateway(ExtractionCapability capability) {
        this(capability, ExtractionConfig.defaults(), new Retrier(RetryPolicy.defaults()),
                new NoOpMetricsService(), new NoOpTracingService());
    }

    public ExtractionGateway(ExtractionCapability capability, ExtractionConfig config, Retrier retrier,
                             MetricsService metricsService, TracingService tracingService) {
        this.capability = Objects.requireNonNull(capability, "capability is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.retrier = Objects.requireNonNull(retrier, "retrier is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
        this.chunker = new TextChunker(config.maxChunkChars(), config.chunkOverlapChars());
        this.workers = Executors.newFixedThreadPool(config.maxConcurrency(), namedThreads("kgraph-extract"));
        this.timeouts = Executors.newSingleThreadScheduledExecutor(namedThreads("kgraph-extract-timeout"));
    }

    /**
     * Chunks the document and schedules every chunk. If the capability reports itself unavailable,
     * no chunk is sent and every chunk fails at once.
     *
     * @return one future per chunk, in chunk order; each completes normally with the chunk's outcome
     */
    public List<CompletableFuture<ChunkOutcome>> submit(String documentId, String text) {
        Objects.requireNonNull(documentId, "documentId is required");
        List<TextChunk> chunks = chunker.chunk(documentId, text);
        log.debug("extract.submitted documentId={} chunks={} textLength={}",
                documentId, chunks.size(), text != null ? text.length() : 0);

        List<CompletableFuture<ChunkOutcome>> futures = new ArrayList<>(chunks.size());
        if (!chunks.isEmpty() && !capability.isAvailable()) {
            log.warn("extract.capability_unavailable documentId={} chunks={}", documentId, chunks.size());
            for (TextChunk chunk : chunks) {
                metricsService.recordChunkExtraction(ChunkStatus.FAILED.name(), Duration.ZERO);
                futures.add(CompletableFuture.completedFuture(
                        ChunkOutcome.failed(chunk, Duration.ZERO, UNAVAILABLE)));
            }
            return futures;
        }
        for (TextChunk chunk : chunks) {
            futures.add(schedule(chunk, text));
        }
        return futures;
    }

    /**
     * Extracts the document and hands every chunk outcome to {@code sink} on the calling
     * thread, in completion order. Returns once every chunk has been delivered.
     *
     * @return the number of chunks
     */
    public int extract(String documentId, String text, Consumer<ChunkOutcome> sink) {
        List<CompletableFuture<ChunkOutcome>> futures = submit(documentId, text);
        BlockingQueue<ChunkOutcome> completed = new LinkedBlockingQueue<>();
        for (CompletableFuture<ChunkOutcome> future : futures) {
            future.thenAccept(completed::add);
        }
        for (int delivered = 0; delivered < futures.size(); delivered++) {
            ChunkOutcome outcome;
            try {
                outcome = completed.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while extracting document " + documentId, e);
            }
            sink.accept(outcome);
        }
        return futures.size();
    }

    private CompletableFuture<ChunkOutcome> schedule(TextChunk chunk, String document) {
        CompletableFuture<ChunkOutcome> outcome = new CompletableFuture<>();
        AtomicReference<FutureTask<Void>> handle = new AtomicReference<>();
        FutureTask<Void> task = new FutureTask<>(() -> runChunk(chunk, document, outcome, handle), null);
        handle.set(task);
        workers.execute(task);
        return outcome;
    }

    private void runChunk(TextChunk chunk, String document, CompletableFuture<ChunkOutcome> outcome,
                          AtomicReference<FutureTask<Void>> handle) {
        long startNanos = System.nanoTime();
        ScheduledFuture<?> timer = timeouts.schedule(() -> {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            if (outcome.complete(ChunkOutcome.timedOut(chunk, elapsed))) {
                log.warn("extract.chunk_timed_out documentId={} chunkIndex={} timeoutMs={}",
                        chunk.documentId(), chunk.index(), config.chunkTimeout().toMillis());
                metricsService.recordChunkExtraction(ChunkStatus.TIMED_OUT.name(), elapsed);
                handle.get().cancel(true);
            }
        }, config.chunkTimeout().toMillis(), TimeUnit.MILLISECONDS);

        try (LogContext ctx = LogContext.forChunk(chunk.documentId(), chunk.index());
             TraceSpan span = tracingService.startSpan("extract.chunk")) {
            span.setAttribute("documentId", chunk.documentId());
            span.setAttribute("chunkIndex", chunk.index());
            ChunkOutcome result;
            try {
                ExtractionResult extracted = retrier.call(
                        "extract " + chunk.documentId() + "#" + chunk.index(),
                        () -> capability.extract(chunk.text()));
                result = toOutcome(chunk, document, extracted, Duration.ofNanos(System.nanoTime() - startNanos));
                span.setAttribute("mentions", result.mentions().size());
                span.setStatus(TraceSpan.Status.OK);
            } catch (RuntimeException e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                result = ChunkOutcome.failed(chunk, elapsed, e.getMessage());
                span.recordException(e);
                span.setStatus(TraceSpan.Status.ERROR);
                if (!outcome.isDone()) {
                    log.warn("extract.chunk_failed documentId={} chunkIndex={} error={}",
                            chunk.documentId(), chunk.index(), e.getMessage());
                }
            }
            if (outcome.complete(result)) {
                metricsService.recordChunkExtraction(result.status().name(), result.duration());
                log.debug("extract.chunk_completed documentId={} chunkIndex={} status={} mentions={} durationMs={}",
                        chunk.documentId(), chunk.index(), result.status(), result.mentions().size(),
                        result.duration().toMillis());
            }
        } finally {
            timer.cancel(false);
        }
    }

    private ChunkOutcome toOutcome(TextChunk chunk, String document, ExtractionResult extracted, Duration elapsed) {
        if (extracted == null) {
            return ChunkOutcome.succeeded(chunk, List.of(), List.of(), elapsed);
        }
        List<RawMention> mentions = new ArrayList<>(extracted.mentions().size());
        // extractor index -> position in mentions, -1 when the span belongs to the next chunk
        int[] positions = new int[extracted.mentions().size()];
        Map<String, Integer> bySpan = new HashMap<>();
        for (int i = 0; i < positions.length; i++) {
            ExtractedMention m = extracted.mentions().get(i);
            int start = chunk.startOffset() + m.start();
            int end = chunk.startOffset() + m.end();
            if (!chunk.owns(start)) {
                positions[i] = -1;
                continue;
            }
            RawMention mention = RawMention.of(chunk.documentId(), m.surfaceForm(), start, end, m.label(),
                    contextWindow(document, start, end));
            Integer seen = bySpan.putIfAbsent(mention.mentionId(), mentions.size());
            if (seen != null) {
                positions[i] = seen;
                continue;
            }
            positions[i] = mentions.size();
            mentions.add(mention);
        }
        if (mentions.size() < positions.length) {
            log.debug("extract.mentions_deduplicated documentId={} chunkIndex={} extracted={} kept={}",
                    chunk.documentId(), chunk.index(), positions.length, mentions.size());
        }

        List<MentionRelation> relations = new ArrayList<>(extracted.relations().size());
        for (ExtractedRelation r : extracted.relations()) {
            if (!isIndex(r.subjectIndex(), positions.length) || !isIndex(r.objectIndex(), positions.length)
                    || r.predicate() == null || r.predicate().isBlank()) {
                log.warn("extract.relation_dropped documentId={} chunkIndex={} relation={}",
                        chunk.documentId(), chunk.index(), r);
                continue;
            }
            int subject = positions[r.subjectIndex()];
            int object = positions[r.objectIndex()];
            if (subject < 0 || object < 0) {
                log.debug("extract.relation_left_to_next_chunk documentId={} chunkIndex={} relation={}",
                        chunk.documentId(), chunk.index(), r);
                continue;
            }
            relations.add(new MentionRelation(
                    mentions.get(subject).mentionId(),
                    r.predicate(),
                    mentions.get(object).mentionId()));
        }
        return ChunkOutcome.succeeded(chunk, mentions, relations, elapsed);
    }

    private String contextWindow(String document, int start, int end) {
        if (document == null || start < 0 || end > document.length() || start >= end) {
            return "";
        }
        int from = Math.max(0, start - config.contextWindowChars());
        int to = Math.min(document.length(), end + config.contextWindowChars());
        return document.substring(from, to);
    }

    private static boolean isIndex(int index, int size) {
        return index >= 0 && index < size;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        workers.shutdown();
        timeouts.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        timeouts.shutdownNow();
    }
}
