package com.kgraph.resolution.merge;

import com.kgraph.resolution.audit.DecisionLog;
import com.kgraph.resolution.core.model.Candidate;
import com.kgraph.resolution.core.model.CanonicalEntity;
import com.kgraph.resolution.core.model.DecisionTier;
import com.kgraph.resolution.core.model.EntityType;
import com.kgraph.resolution.core.model.MergeDecision;
import com.kgraph.resolution.core.model.RawMention;
import com.kgraph.resolution.rules.CandidateNormalizer;
import com.kgraph.resolution.similarity.ResolutionDecision;
import com.kgraph.resolution.similarity.SimilarityResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MergeEngine Tests")
class MergeEngineTest {

    private final CandidateNormalizer normalizer = new CandidateNormalizer();
    private final SimilarityResolver resolver = new SimilarityResolver();
    private DecisionLog decisionLog;
    private MergeEngine engine;
    private int offset;

    @BeforeEach
    void setUp() {
        decisionLog = new DecisionLog();
        engine = new MergeEngine(decisionLog);
        offset = 0;
    }

    private Candidate candidate(String documentId, String surface, String label) {
        int start = offset;
        offset += surface.length() + 1;
        return normalizer.normalize(RawMention.of(documentId, surface, start, start + surface.length(), label, ""));
    }

    private ApplyOutcome resolveAndApply(Candidate candidate) {
        return engine.apply(resolver.resolve(candidate, engine));
    }

    private ApplyOutcome ingest(String surface, String label) {
        return resolveAndApply(candidate("doc", surface, label));
    }

    @Nested
    @DisplayName("Applying decisions")
    class Applying {

        @Test
        @DisplayName("Variants of a company name should converge on one entity")
        void companyVariants() {
            ApplyOutcome first = ingest("Apple", "org");
            ApplyOutcome second = ingest("Apple Inc", "org");
            ApplyOutcome third = ingest("Apple Inc.", "org");

            assertEquals(ApplyOutcome.Kind.CREATED, first.kind());
            assertEquals(ApplyOutcome.Kind.MERGED, second.kind());
            assertEquals(DecisionTier.HIGH_CONFIDENCE, third.tier());
            assertEquals(first.entityId(), third.entityId());

            CanonicalEntity apple = engine.getEntity(first.entityId()).orElseThrow();
            assertEquals(Set.of("Apple", "Apple Inc", "Apple Inc."), apple.getAliases());
            assertEquals("Apple Inc.", apple.getPrimaryLabel());
            assertEquals(3, apple.getMentionCount());
            assertEquals(1, engine.entityCount());
        }

        @Test
        @DisplayName("A name variant should merge with low confidence")
        void lowConfidenceMerge() {
            ApplyOutcome tim = ingest("Tim Cook", "person");
            ApplyOutcome timothy = ingest("Timothy Cook", "person");

            assertEquals(tim.entityId(), timothy.entityId());
            assertEquals(DecisionTier.LOW_CONFIDENCE, timothy.tier());
            assertTrue(timothy.requiresReview());
            assertEquals(1, decisionLog.byTier(DecisionTier.LOW_CONFIDENCE).size());
        }

        @Test
        @DisplayName("Every applied decision should be logged, creations included")
        void logsEveryDecision() {
            ApplyOutcome created = ingest("Apple", "org");
            ingest("Apple Inc.", "org");

            List<MergeDecision> logged = decisionLog.getAll();
            assertEquals(2, logged.size());
            assertEquals("new", logged.get(0).matchedEntityLabel());
            assertEquals(created.entityId(), logged.get(0).resultEntityId());
            assertEquals(created.entityId(), logged.get(1).matchedEntityId());
            assertEquals(DecisionTier.HIGH_CONFIDENCE, logged.get(1).tier());
        }

        @Test
        @DisplayName("Snapshots should record provenance and documents")
        void provenance() {
            resolveAndApply(candidate("doc-a", "Apple", "org"));
            ApplyOutcome second = resolveAndApply(candidate("doc-b", "Apple", "org"));

            CanonicalEntity apple = engine.getEntity(second.entityId()).orElseThrow();
            assertEquals(Set.of("doc-a", "doc-b"), apple.getDocumentIds());
            assertEquals(2, apple.getProvenance().size());
            assertEquals(2, apple.getFrequency("Apple"));
            assertEquals(2, apple.getVersion());
        }

        @Test
        @DisplayName("Different types should not merge even with the same key")
        void typeConflict() {
            ApplyOutcome company = ingest("Apple", "org");
            ApplyOutcome fruit = ingest("Apple", "product");

            assertEquals(ApplyOutcome.Kind.CREATED, fruit.kind());
            assertEquals(DecisionTier.TYPE_CONFLICT, fruit.tier());
            assertNotEquals(company.entityId(), fruit.entityId());
            assertEquals(company.entityId(), fruit.resolution().conflictingEntityId());
            assertEquals(EntityType.PRODUCT, engine.getEntity(fruit.entityId()).orElseThrow().getType());
        }

        @Test
        @DisplayName("A type clash between two fresh decisions should be caught when the second is applied")
        void typeConflictOnApply() {
            ResolutionDecision company = resolver.resolve(candidate("doc-a", "Apple", "org"), engine);
            ResolutionDecision product = resolver.resolve(candidate("doc-b", "Apple", "product"), engine);
            assertEquals(DecisionTier.NEW_ENTITY, product.tier());

            ApplyOutcome first = engine.apply(company);
            ApplyOutcome second = engine.apply(product);

            assertEquals(DecisionTier.NEW_ENTITY, first.tier());
            assertEquals(DecisionTier.TYPE_CONFLICT, second.tier());
            assertTrue(second.requiresReview());
            assertEquals(first.entityId(), second.resolution().conflictingEntityId());
            assertEquals(DecisionTier.TYPE_CONFLICT, decisionLog.getAll().get(1).tier());
            assertEquals(2, engine.entityCount());
        }

        @Test
        @DisplayName("A stale merge decision across types should be refused")
        void refusesCrossTypeMergeDecision() {
            ApplyOutcome company = ingest("Apple", "org");
            Candidate product = candidate("doc", "Apple", "product");

            ApplyOutcome outcome = engine.apply(ResolutionDecision.mergeInto(product, company.entityId(), 1.0,
                    DecisionTier.HIGH_CONFIDENCE, "PRODUCT|app", "forced"));

            assertEquals(DecisionTier.TYPE_CONFLICT, outcome.tier());
            assertNotEquals(company.entityId(), outcome.entityId());
            assertEquals(1, engine.getEntity(company.entityId()).orElseThrow().getMentionCount());
        }
    }

    @Nested
    @DisplayName("Idempotence and monotonicity")
    class Replay {

        @Test
        @DisplayName("Applying the same mention twice should change nothing")
        void replayIsNoOp() {
            Candidate apple = candidate("doc", "Apple", "org");
            ApplyOutcome first = resolveAndApply(apple);
            CanonicalEntity before = engine.getEntity(first.entityId()).orElseThrow();

            ApplyOutcome again = resolveAndApply(apple);

            assertTrue(again.isReplay());
            assertEquals(first.entityId(), again.entityId());
            assertEquals(before, engine.getEntity(first.entityId()).orElseThrow());
            assertEquals(1, decisionLog.size());
            assertTrue(engine.replay(apple.mentionId()).isPresent());
            assertTrue(engine.isApplied(apple.mentionId()));
        }

        @Test
        @DisplayName("Aliases and frequencies should only grow")
        void monotonic() {
            List<Map<String, Integer>> history = new ArrayList<>();
            int entityId = ingest("Apple", "org").entityId();
            history.add(engine.getEntity(entityId).orElseThrow().getAliasFrequencies());
            for (String surface : List.of("Apple Inc", "Apple", "Apple Inc.", "Apple")) {
                ingest(surface, "org");
                history.add(engine.getEntity(entityId).orElseThrow().getAliasFrequencies());
            }

            for (int i = 1; i < history.size(); i++) {
                Map<String, Integer> previous = history.get(i - 1);
                Map<String, Integer> current = history.get(i);
                assertTrue(current.keySet().containsAll(previous.keySet()));
                previous.forEach((alias, count) -> assertTrue(current.get(alias) >= count));
            }
            assertEquals("Apple", engine.getEntity(entityId).orElseThrow().getPrimaryLabel());
        }
    }

    @Nested
    @DisplayName("Merging entities")
    class MergingEntities {

        @Test
        @DisplayName("The target should survive and absorb the source")
        void mergeEntities() {
            int big = ingest("International Business Machines", "org").entityId();
            int ibm = ingest("IBM", "org").entityId();
            assertNotEquals(big, ibm);
            List<CanonicalEntity> notified = new ArrayList<>();
            List<Integer> sources = new ArrayList<>();
            engine.addMergeListener(new MergeListener() {
                @Override
                public void onEntitiesMerged(int sourceEntityId, CanonicalEntity target) {
                    sources.add(sourceEntityId);
                    notified.add(target);
                }
            });

            CanonicalEntity merged = engine.mergeEntities(ibm, big, "reviewer", false);

            assertEquals(big, merged.getId());
            assertEquals(Set.of("International Business Machines", "IBM"), merged.getAliases());
            assertEquals(Set.of(ibm), merged.getMergedEntityIds());
            assertEquals(big, engine.resolveId(ibm));
            assertEquals(big, engine.getEntity(ibm).orElseThrow().getId());
            assertEquals(1, engine.getEntities().size());
            assertEquals(List.of(ibm), sources);
            assertEquals(merged, notified.get(0));
        }

        @Test
        @DisplayName("Mentions of an absorbed entity should keep resolving to the survivor")
        void mentionsFollowTheSurvivor() {
            Candidate ibmMention = candidate("doc", "IBM", "org");
            int big = ingest("International Business Machines", "org").entityId();
            int ibm = resolveAndApply(ibmMention).entityId();

            engine.mergeEntities(ibm, big, "reviewer", false);

            assertEquals(big, engine.rootOfMention(ibmMention.mentionId()).orElseThrow());
            assertEquals(big, engine.lookup(ibmMention.mentionId()).orElseThrow().getId());
            assertEquals(big, resolveAndApply(candidate("doc", "IBM", "org")).entityId());
        }

        @Test
        @DisplayName("Merging different types should need an override")
        void typeOverride() {
            int company = ingest("Apple", "org").entityId();
            int product = ingest("Apple", "product").entityId();

            TypeConflictException e = assertThrows(TypeConflictException.class,
                    () -> engine.mergeEntities(product, company, "reviewer", false));
            assertEquals(product, e.getSourceEntityId());

            CanonicalEntity merged = engine.mergeEntities(product, company, "reviewer", true);
            assertEquals(EntityType.ORGANIZATION, merged.getType());
            assertEquals(2, merged.getMentionCount());
            assertEquals(DecisionTier.TYPE_CONFLICT, decisionLog.getAll().get(decisionLog.size() - 1).tier());
        }

        @Test
        @DisplayName("Merging an entity with itself should be a no-op")
        void selfMerge() {
            int apple = ingest("Apple", "org").entityId();
            CanonicalEntity before = engine.getEntity(apple).orElseThrow();

            assertEquals(before, engine.mergeEntities(apple, apple, "reviewer", false));
        }

        @Test
        @DisplayName("A failing listener should not break the merge")
        void failingListener() {
            engine.addMergeListener(new MergeListener() {
                @Override
                public void onEntityUpdated(CanonicalEntity entity) {
                    throw new IllegalStateException("listener broke");
                }
            });

            ApplyOutcome outcome = ingest("Apple", "org");
            assertTrue(engine.getEntity(outcome.entityId()).isPresent());
        }

        @Test
        @DisplayName("A listener reporting corruption during a merge should fail it and mark the registry")
        void corruptingListener() {
            int big = ingest("International Business Machines", "org").entityId();
            int ibm = ingest("IBM", "org").entityId();
            engine.addMergeListener(new MergeListener() {
                @Override
                public void onEntitiesMerged(int sourceEntityId, CanonicalEntity target) {
                    throw new RegistryCorruptionException("graph lost entity " + sourceEntityId);
                }
            });

            assertTrue(engine.getCorruption().isEmpty());
            RegistryCorruptionException e = assertThrows(RegistryCorruptionException.class,
                    () -> engine.mergeEntities(ibm, big, "reviewer", false));

            assertSame(e, engine.getCorruption().orElseThrow());
            assertEquals(big, engine.resolveId(ibm));
        }
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("Unknown ids and mentions should be empty")
        void unknown() {
            assertTrue(engine.getEntity(42).isEmpty());
            assertTrue(engine.lookup("nope@0-1").isEmpty());
            assertTrue(engine.rootOfMention("nope@0-1").isEmpty());
            assertTrue(engine.replay("nope@0-1").isEmpty());
        }

        @Test
        @DisplayName("Entities should be listed by id")
        void listedById() {
            ingest("Zeta Corp", "org");
            ingest("Alpha Corp", "org");
            ingest("Tim Cook", "person");

            assertEquals(List.of(1, 2, 3), engine.getEntities().stream().map(CanonicalEntity::getId).toList());
        }

        @Test
        @DisplayName("Block and key indexes should return roots")
        void indexes() {
            int big = ingest("International Business Machines", "org").entityId();
            int ibm = ingest("IBM", "org").entityId();
            engine.mergeEntities(ibm, big, "reviewer", false);

            assertEquals(List.of(big), engine.entitiesWithKey("ibm").stream().map(CanonicalEntity::getId).toList());
            assertEquals(List.of(big), engine.entitiesInBlock("ORGANIZATION|ibm").stream()
                    .map(CanonicalEntity::getId).toList());
        }
    }
}
