package com.kgraph.resolution.search;

import com.kgraph.resolution.core.model.CanonicalEntity;
import com.kgraph.resolution.core.model.EntityType;
import com.kgraph.resolution.graph.GraphNeighbor;
import com.kgraph.resolution.graph.GraphStore;
import com.kgraph.resolution.logging.LogContext;
import com.kgraph.resolution.merge.MergeEngine;
import com.kgraph.resolution.rules.CandidateNormalizer;
import com.kgraph.resolution.similarity.CompositeSimilarityScorer;
import com.kgraph.resolution.similarity.EmbeddingFunction;
import com.kgraph.resolution.similarity.EmbeddingSimilarity;
import com.kgraph.resolution.similarity.LevenshteinSimilarity;
import com.kgraph.resolution.tracing.NoOpTracingService;
import com.kgraph.resolution.tracing.TraceSpan;
import com.kgraph.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Answers free-text queries over the resolved entities.
 *
 * <p>Seeds are scored by embedding cosine against each entity's label and aliases when an
 * {@link EmbeddingFunction} is configured, and by the composite lexical scorer against alias
 * keys otherwise. The best seeds are then expanded through the graph store; a neighbor's
 * relevance is the seed score times {@code hopDecay} per hop. Hits reached several ways keep
 * their best score. Optional boost keywords add to the score of hits whose aliases match them
 * fuzzily, before ranking and limiting. Nothing here mutates the registry or the graph.</p>
 */
public class HybridSearchService {
    private static final Logger log = LoggerFactory.getLogger(HybridSearchService.class);

    private static final Comparator<SearchHit> RANKING = Comparator
            .comparingDouble(SearchHit::score).reversed()
            .thenComparingInt(SearchHit::hops)
            .thenComparingInt(SearchHit::entityId);

    private static final LevenshteinSimilarity LEVENSHTEIN = new LevenshteinSimilarity();
    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final MergeEngine registry;
    private final GraphStore graphStore;
    private final EmbeddingFunction embeddingFunction;
    private final CandidateNormalizer normalizer;
    private final CompositeSimilarityScorer lexicalScorer;
    private final SearchOptions options;
    private final TracingService tracingService;

    private HybridSearchService(Builder builder) {
        this.registry = Objects.requireNonNull(builder.registry, "registry is required");
        this.graphStore = Objects.requireNonNull(builder.graphStore, "graphStore is required");
        this.embeddingFunction = builder.embeddingFunction;
        this.normalizer = builder.normalizer != null ? builder.normalizer : new CandidateNormalizer();
        this.lexicalScorer = builder.lexicalScorer != null ? builder.lexicalScorer : new CompositeSimilarityScorer();
        this.options = builder.options != null ? builder.options : SearchOptions.defaults();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
    }

    /**
     * Ranked entities for {@code text}.
     *
     * @param limit        maximum number of hits, at least 1
     * @param exploreDepth graph hops to expand each seed by, clamped to {@code [0, maxExploreDepth]}
     */
    public List<SearchHit> query(String text, int limit, int exploreDepth) {
        return query(text, limit, exploreDepth, List.of());
    }

    /**
     * Ranked entities for {@code text}, with hits whose aliases fuzzily match one of
     * {@code boostKeywords} moved up.
     *
     * @param boostKeywords words to favour; each match adds {@code keywordBoostWeight} times its similarity
     */
    public List<SearchHit> query(String text, int limit, int exploreDepth, Collection<String> boostKeywords) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, got " + limit);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }
        int depth = options.clampDepth(exploreDepth);
        List<String> keywords = keywords(boostKeywords);
        String correlationId = LogContext.generateCorrelationId();

        try (LogContext ctx = LogContext.forSearch(correlationId);
             TraceSpan span = tracingService.startSpan("search")) {
            span.setAttribute("search.depth", depth);
            span.setAttribute("search.limit", limit);

            List<SearchHit> seeds = seeds(text);
            Map<Integer, SearchHit> best = new HashMap<>();
            for (SearchHit seed : seeds) {
                best.merge(seed.entityId(), seed, HybridSearchService::better);
            }
            if (depth > 0) {
                for (SearchHit seed : seeds.subList(0, Math.min(seeds.size(), options.maxSeeds()))) {
                    expand(seed, depth, best);
                }
            }

            List<SearchHit> ranked = new ArrayList<>(best.values());
            if (!keywords.isEmpty()) {
                ranked.replaceAll(hit -> boost(hit, keywords));
            }
            ranked.sort(RANKING);
            List<SearchHit> hits = ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : List.copyOf(ranked);

            span.setAttribute("search.seeds", seeds.size());
            span.setAttribute("search.hits", hits.size());
            span.setStatus(TraceSpan.Status.OK);
            log.info("search.completed seeds={} hits={} depth={} mode={} boostKeywords={}",
                    seeds.size(), hits.size(), depth, embeddingFunction != null ? "vector" : "lexical", keywords.size());
            return hits;
        }
    }

    /**
     * Ranked documents for {@code text}: the documents mentioning the entity hits, each scored by
     * its best hit. Documents mentioning a direct match get the entity boost on top.
     */
    public List<DocumentHit> queryDocuments(String text, int limit, int exploreDepth) {
        return queryDocuments(text, limit, exploreDepth, List.of());
    }

    public List<DocumentHit> queryDocuments(String text, int limit, int exploreDepth,
                                            Collection<String> boostKeywords) {
        return rankDocuments(query(text, limit, exploreDepth, boostKeywords), options.entityBoostWeight());
    }

    static List<DocumentHit> rankDocuments(List<SearchHit> hits) {
        return rankDocuments(hits, 0.0);
    }

    static List<DocumentHit> rankDocuments(List<SearchHit> hits, double entityBoostWeight) {
        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, Set<Integer>> entities = new LinkedHashMap<>();
        Set<String> mentionDirectMatch = new HashSet<>();
        double bestSeedScore = 0.0;
        for (SearchHit hit : hits) {
            if (hit.isDirectMatch()) {
                bestSeedScore = Math.max(bestSeedScore, hit.score());
                mentionDirectMatch.addAll(hit.documentIds());
            }
            for (String documentId : hit.documentIds()) {
                scores.merge(documentId, hit.score(), Math::max);
                entities.computeIfAbsent(documentId, k -> new LinkedHashSet<>()).add(hit.entityId());
            }
        }
        double entityBoost = entityBoostWeight * bestSeedScore;
        List<DocumentHit> documents = new ArrayList<>(scores.size());
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            double score = entry.getValue() + (mentionDirectMatch.contains(entry.getKey()) ? entityBoost : 0.0);
            documents.add(new DocumentHit(entry.getKey(), score, new ArrayList<>(entities.get(entry.getKey()))));
        }
        documents.sort(Comparator.comparingDouble(DocumentHit::score).reversed()
                .thenComparing(DocumentHit::documentId));
        return documents;
    }

    /**
     * Best fuzzy similarity between {@code keyword} and the entity's aliases, compared whole and word by word.
     */
    static double keywordMatch(String keyword, CanonicalEntity entity) {
        double best = 0.0;
        for (String alias : entity.getAliases()) {
            String lowered = alias.toLowerCase(Locale.ROOT);
            best = Math.max(best, LEVENSHTEIN.compute(keyword, lowered));
            for (String word : WORD_SEPARATOR.split(lowered)) {
                if (!word.isEmpty()) {
                    best = Math.max(best, LEVENSHTEIN.compute(keyword, word));
                }
            }
        }
        return best;
    }

    private SearchHit boost(SearchHit hit, List<String> keywords) {
        CanonicalEntity entity = registry.getEntity(hit.entityId()).orElse(null);
        if (entity == null) {
            return hit;
        }
        double boost = 0.0;
        for (String keyword : keywords) {
            double match = keywordMatch(keyword, entity);
            if (match >= options.keywordMatchThreshold()) {
                boost += options.keywordBoostWeight() * match;
            }
        }
        if (boost == 0.0) {
            return hit;
        }
        log.debug("search.keyword_boost entityId={} boost={}", hit.entityId(), boost);
        return hit.withScore(hit.score() + boost);
    }

    private static List<String> keywords(Collection<String> boostKeywords) {
        if (boostKeywords == null || boostKeywords.isEmpty()) {
            return List.of();
        }
        List<String> keywords = new ArrayList<>(boostKeywords.size());
        for (String keyword : boostKeywords) {
            if (keyword != null && !keyword.isBlank()) {
                keywords.add(keyword.trim().toLowerCase(Locale.ROOT));
            }
        }
        return keywords;
    }

    public SearchOptions getOptions() {
        return options;
    }

    private List<SearchHit> seeds(String text) {
        float[] queryVector = embeddingFunction != null ? embeddingFunction.embed(text) : null;
        Map<EntityType, String> queryKeys = new EnumMap<>(EntityType.class);

        List<SearchHit> seeds = new ArrayList<>();
        for (CanonicalEntity entity : registry.getEntities()) {
            double score = queryVector != null
                    ? vectorScore(queryVector, entity)
                    : lexicalScore(queryKeys.computeIfAbsent(entity.getType(), t -> normalizer.keyFor(text, t)), entity);
            if (score >= options.minScore()) {
                seeds.add(hit(entity, score, 0, entity.getId()));
            }
        }
        seeds.sort(RANKING);
        log.debug("search.seeds count={}", seeds.size());
        return seeds;
    }

    private double vectorScore(float[] queryVector, CanonicalEntity entity) {
        double best = EmbeddingSimilarity.cosine(queryVector, embeddingFunction.embed(entity.getPrimaryLabel()));
        for (String alias : entity.getAliases()) {
            best = Math.max(best, EmbeddingSimilarity.cosine(queryVector, embeddingFunction.embed(alias)));
        }
        return best;
    }

    private double lexicalScore(String queryKey, CanonicalEntity entity) {
        if (queryKey.isEmpty()) {
            return 0.0;
        }
        double best = 0.0;
        for (String aliasKey : entity.getAliasKeys()) {
            best = Math.max(best, lexicalScorer.compute(queryKey, aliasKey));
        }
        return best;
    }

    private void expand(SearchHit seed, int depth, Map<Integer, SearchHit> best) {
        for (GraphNeighbor neighbor : graphStore.query(seed.entityId(), depth)) {
            CanonicalEntity entity = registry.getEntity(neighbor.nodeId()).orElse(null);
            if (entity == null || entity.getId() == seed.entityId()) {
                continue;
            }
            double score = seed.score() * Math.pow(options.hopDecay(), neighbor.hops());
            best.merge(entity.getId(), hit(entity, score, neighbor.hops(), seed.entityId()), HybridSearchService::better);
        }
    }

    private static SearchHit hit(CanonicalEntity entity, double score, int hops, int seedId) {
        return new SearchHit(entity.getId(), entity.getPrimaryLabel(), entity.getType(), score, hops, seedId,
                entity.getDocumentIds());
    }

    private static SearchHit better(SearchHit a, SearchHit b) {
        return RANKING.compare(a, b) <= 0 ? a : b;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MergeEngine registry;
        private GraphStore graphStore;
        private EmbeddingFunction embeddingFunction;
        private CandidateNormalizer normalizer;
        private CompositeSimilarityScorer lexicalScorer;
        private SearchOptions options;
        private TracingService tracingService;

        public Builder registry(MergeEngine registry) {
            this.registry = registry;
            return this;
        }

        public Builder graphStore(GraphStore graphStore) {
            this.graphStore = graphStore;
            return this;
        }

        /**
         * Enables vector scoring. Wrap the function in an
         * {@link com.kgraph.resolution.cache.EmbeddingCache} to avoid re-embedding aliases per query.
         */
        public Builder embeddingFunction(EmbeddingFunction embeddingFunction) {
            this.embeddingFunction = embeddingFunction;
            return this;
        }

        public Builder normalizer(CandidateNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder lexicalScorer(CompositeSimilarityScorer lexicalScorer) {
            this.lexicalScorer = lexicalScorer;
            return this;
        }

        public Builder options(SearchOptions options) {
            this.options = options;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public HybridSearchService build() {
            return new HybridSearchService(this);
        }
    }
}
