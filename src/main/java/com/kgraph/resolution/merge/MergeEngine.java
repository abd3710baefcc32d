package com.kgraph.resolution.merge;

import com.kgraph.resolution.audit.DecisionLog;
import com.kgraph.resolution.core.model.Candidate;
import com.kgraph.resolution.core.model.CanonicalEntity;
import com.kgraph.resolution.core.model.DecisionTier;
import com.kgraph.resolution.core.model.EntityType;
import com.kgraph.resolution.core.model.MergeDecision;
import com.kgraph.resolution.logging.LogContext;
import com.kgraph.resolution.metrics.MetricsService;
import com.kgraph.resolution.metrics.NoOpMetricsService;
import com.kgraph.resolution.similarity.RegistrySnapshot;
import com.kgraph.resolution.similarity.ResolutionDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Applies resolution decisions to the entity registry.
 *
 * <p>Decisions of different normalized keys are applied in parallel; the callers serialize each
 * blocking bucket, and all scoring happens before {@link #apply(ResolutionDecision)} is called.
 * Decisions sharing a normalized key are applied one at a time. {@link #mergeEntities} excludes every
 * other write. Readers go through immutable {@link CanonicalEntity} snapshots published after each
 * write and never block.</p>
 *
 * <p>Applying the same mention twice is a no-op that returns the mention's current root.
 * Every other applied decision, including entity creation, is appended to the {@link DecisionLog}.</p>
 */
public class MergeEngine implements RegistrySnapshot {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    private static final int KEY_STRIPES = 64;

    private final ReadWriteLock structureLock = new ReentrantReadWriteLock();
    private final Object[] keyLocks = new Object[KEY_STRIPES];
    private final AtomicReference<RegistryCorruptionException> corruption = new AtomicReference<>();
    private final EntityArena arena = new EntityArena();
    private final Map<Integer, CanonicalEntity> snapshots = new ConcurrentHashMap<>();
    private final Map<String, Integer> mentionIndex = new ConcurrentHashMap<>();
    private final Map<String, Set<Integer>> blockIndex = new ConcurrentHashMap<>();
    private final Map<String, Set<Integer>> keyIndex = new ConcurrentHashMap<>();
    private final List<MergeListener> listeners = new CopyOnWriteArrayList<>();
    private final DecisionLog decisionLog;
    private final MetricsService metricsService;

    public MergeEngine(DecisionLog decisionLog) {
        this(decisionLog, new NoOpMetricsService());
    }

    public MergeEngine(DecisionLog decisionLog, MetricsService metricsService) {
        this.decisionLog = Objects.requireNonNull(decisionLog, "decisionLog is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        for (int i = 0; i < KEY_STRIPES; i++) {
            keyLocks[i] = new Object();
        }
    }

    public void addMergeListener(MergeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    public void removeMergeListener(MergeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Applies one decision.
     *
     * <p>A decision to create an entity is turned into a type conflict when another root of a
     * different type already carries the candidate's normalized key. The check and the index update
     * run under the key's stripe, whatever the blocking bucket, so of two same-key mentions of
     * different types the one applied second is always the one flagged.</p>
     *
     * @return what happened and the canonical root the mention maps to
     */
    public ApplyOutcome apply(ResolutionDecision decision) {
        Candidate candidate = decision.candidate();
        ApplyOutcome outcome;
        CanonicalEntity updated;

        try (LogContext ctx = LogContext.forMerge(candidate.mentionId(), decision.blockingKey())) {
            structureLock.readLock().lock();
            try {
                synchronized (keyLock(candidate.normalizedKey())) {
                    Integer applied = mentionIndex.get(candidate.mentionId());
                    if (applied != null) {
                        int root = arena.root(applied);
                        log.debug("merge.replayed mentionId={} entityId={}", candidate.mentionId(), root);
                        metricsService.incrementMentionReplayed();
                        return ApplyOutcome.replayed(root);
                    }

                    ResolutionDecision effective = decision;
                    EntityRecord record;
                    if (decision.isMerge()) {
                        EntityRecord target = arena.record(arena.root(decision.targetEntityId()));
                        if (target.type() != candidate.entityType()) {
                            String reason = "target entity " + target.id() + " is " + target.type()
                                    + ", candidate is " + candidate.entityType();
                            log.warn("merge.refused mentionId={} reason='{}'", candidate.mentionId(), reason);
                            effective = ResolutionDecision.typeConflict(candidate, target.id(),
                                    decision.blockingKey(), reason);
                            record = arena.allocate(candidate.entityType());
                        } else {
                            record = target;
                        }
                    } else {
                        if (decision.tier() != DecisionTier.TYPE_CONFLICT) {
                            effective = checkTypeConflict(decision);
                        }
                        record = arena.allocate(candidate.entityType());
                    }

                    synchronized (record) {
                        record.addMention(candidate, decision.blockingKey());
                        updated = record.snapshot();
                        snapshots.put(record.id(), updated);
                    }
                    mentionIndex.put(candidate.mentionId(), record.id());
                    index(blockIndex, decision.blockingKey(), record.id());
                    index(keyIndex, candidate.normalizedKey(), record.id());

                    MergeDecision logged = decisionLog.append(MergeDecision.builder()
                            .candidate(candidate)
                            .matchedEntityId(effective.isMerge() ? record.id() : null)
                            .resultEntityId(record.id())
                            .score(effective.score())
                            .tier(effective.tier())
                            .reasoning(effective.reasoning())
                            .build());

                    ApplyOutcome.Kind kind = effective.isMerge()
                            ? ApplyOutcome.Kind.MERGED : ApplyOutcome.Kind.CREATED;
                    outcome = new ApplyOutcome(record.id(), kind, effective.tier(), logged, effective);
                    recordMetrics(candidate, effective);
                    log.debug("merge.applied mentionId={} entityId={} kind={} tier={} label='{}' version={}",
                            candidate.mentionId(), record.id(), kind, effective.tier(), updated.getPrimaryLabel(),
                            updated.getVersion());
                }
            } catch (RegistryCorruptionException e) {
                throw markCorrupted(e);
            } finally {
                structureLock.readLock().unlock();
            }
        }

        for (MergeListener listener : listeners) {
            try {
                listener.onEntityUpdated(updated);
            } catch (RegistryCorruptionException e) {
                throw markCorrupted(e);
            } catch (Exception e) {
                log.warn("Merge listener failed on update of entity {}: {}", updated.getId(), e.getMessage());
            }
        }
        return outcome;
    }

    /**
     * Merges two canonical entities. The target keeps its id and type; the source id keeps resolving,
     * to the target. Runs exclusively: no decision is applied while the union is made.
     *
     * <p>A listener failing with {@link RegistryCorruptionException} marks the registry corrupted and
     * the exception is rethrown; other listener failures are logged, the listener owning the repair.</p>
     *
     * @param sourceEntityId entity to absorb (any id, resolved to its root)
     * @param targetEntityId entity to keep (any id, resolved to its root)
     * @param actor          who asked for the merge, recorded in the decision log
     * @param typeOverride   allow entities of different types to be merged
     * @return the surviving entity
     * @throws TypeConflictException if the types differ and {@code typeOverride} is false
     */
    public CanonicalEntity mergeEntities(int sourceEntityId, int targetEntityId, String actor, boolean typeOverride) {
        CanonicalEntity merged;
        int source;
        structureLock.writeLock().lock();
        try {
            source = arena.find(sourceEntityId);
            int target = arena.find(targetEntityId);
            if (source == target) {
                return snapshots.get(target);
            }
            EntityRecord sourceRecord = arena.record(source);
            EntityRecord targetRecord = arena.record(target);
            if (sourceRecord.type() != targetRecord.type() && !typeOverride) {
                throw new TypeConflictException(source, sourceRecord.type(), target, targetRecord.type());
            }

            try (LogContext ctx = LogContext.forMerge("entity-" + source, String.valueOf(target))) {
                log.info("merge.entities sourceEntityId={} targetEntityId={} actor={} typeOverride={}",
                        source, target, actor, typeOverride);
                CanonicalEntity sourceSnapshot = snapshots.get(source);

                targetRecord.absorb(sourceRecord);
                arena.union(source, target);
                for (String blockingKey : sourceRecord.blockingKeys()) {
                    index(blockIndex, blockingKey, target);
                }
                for (String aliasKey : sourceRecord.aliasKeys()) {
                    index(keyIndex, aliasKey, target);
                }
                merged = targetRecord.snapshot();
                snapshots.put(target, merged);
                snapshots.remove(source);

                decisionLog.append(MergeDecision.builder()
                        .mentionId("entity-" + source)
                        .surfaceForm(sourceSnapshot != null ? sourceSnapshot.getPrimaryLabel() : null)
                        .entityType(sourceRecord.type())
                        .matchedEntityId(target)
                        .resultEntityId(target)
                        .score(1.0)
                        .tier(sourceRecord.type() == targetRecord.type()
                                ? DecisionTier.HIGH_CONFIDENCE : DecisionTier.TYPE_CONFLICT)
                        .reasoning("entity " + source + " merged into " + target + " by " + actor
                                + (typeOverride ? " with type override" : ""))
                        .build());
            }
        } catch (RegistryCorruptionException e) {
            throw markCorrupted(e);
        } finally {
            structureLock.writeLock().unlock();
        }

        for (MergeListener listener : listeners) {
            try {
                listener.onEntitiesMerged(source, merged);
            } catch (RegistryCorruptionException e) {
                throw markCorrupted(e);
            } catch (Exception e) {
                log.warn("Merge listener failed on merge {} -> {}: {}", source, merged.getId(), e.getMessage());
            }
        }
        return merged;
    }

    /**
     * Records that the registry was found corrupted. The first cause is kept.
     *
     * @return {@code e}, for throwing
     */
    public RegistryCorruptionException markCorrupted(RegistryCorruptionException e) {
        if (corruption.compareAndSet(null, e)) {
            log.error("merge.registry_corrupted reason={}", e.getMessage());
        }
        return e;
    }

    /**
     * The corruption that was first detected, if any.
     */
    public Optional<RegistryCorruptionException> getCorruption() {
        return Optional.ofNullable(corruption.get());
    }

    /**
     * Canonical entity a mention resolved to, through the current root.
     */
    public Optional<CanonicalEntity> lookup(String mentionId) {
        Integer id = mentionIndex.get(mentionId);
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshots.get(arena.root(id)));
    }

    /**
     * Entity by id; ids of merged entities resolve to their root.
     */
    public Optional<CanonicalEntity> getEntity(int entityId) {
        if (!arena.contains(entityId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(snapshots.get(arena.root(entityId)));
    }

    /**
     * Current root id of {@code entityId}.
     */
    public int resolveId(int entityId) {
        return arena.root(entityId);
    }

    /**
     * The replay outcome for a mention that was already applied, or empty for a new mention.
     */
    public Optional<ApplyOutcome> replay(String mentionId) {
        Integer applied = mentionIndex.get(mentionId);
        if (applied == null) {
            return Optional.empty();
        }
        int root = arena.root(applied);
        log.debug("merge.replayed mentionId={} entityId={}", mentionId, root);
        metricsService.incrementMentionReplayed();
        return Optional.of(ApplyOutcome.replayed(root));
    }

    public boolean isApplied(String mentionId) {
        return mentionIndex.containsKey(mentionId);
    }

    /**
     * Root id a mention maps to, if the mention was applied.
     */
    public Optional<Integer> rootOfMention(String mentionId) {
        Integer id = mentionIndex.get(mentionId);
        return id == null ? Optional.empty() : Optional.of(arena.root(id));
    }

    /**
     * All root entities, ordered by id.
     */
    public List<CanonicalEntity> getEntities() {
        List<CanonicalEntity> all = new ArrayList<>(snapshots.values());
        all.sort(Comparator.comparingInt(CanonicalEntity::getId));
        return all;
    }

    public int entityCount() {
        return snapshots.size();
    }

    @Override
    public Collection<CanonicalEntity> entitiesInBlock(String blockingKey) {
        return roots(blockIndex.get(blockingKey));
    }

    @Override
    public Collection<CanonicalEntity> entitiesWithKey(String normalizedKey) {
        return roots(keyIndex.get(normalizedKey));
    }

    public DecisionLog getDecisionLog() {
        return decisionLog;
    }

    EntityArena arena() {
        return arena;
    }

    private Collection<CanonicalEntity> roots(Set<Integer> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Set<Integer> rootIds = new LinkedHashSet<>();
        for (Integer id : ids) {
            rootIds.add(arena.root(id));
        }
        List<CanonicalEntity> entities = new ArrayList<>(rootIds.size());
        for (Integer rootId : rootIds) {
            CanonicalEntity entity = snapshots.get(rootId);
            if (entity != null) {
                entities.add(entity);
            }
        }
        return entities;
    }

    private Object keyLock(String normalizedKey) {
        return keyLocks[Math.floorMod(normalizedKey.hashCode(), KEY_STRIPES)];
    }

    private ResolutionDecision checkTypeConflict(ResolutionDecision decision) {
        Candidate candidate = decision.candidate();
        Set<Integer> ids = keyIndex.get(candidate.normalizedKey());
        if (ids == null) {
            return decision;
        }
        Integer conflicting = null;
        EntityType conflictingType = null;
        for (Integer id : ids) {
            int root = arena.root(id);
            EntityType type = arena.record(root).type();
            if (type != candidate.entityType() && (conflicting == null || root < conflicting)) {
                conflicting = root;
                conflictingType = type;
            }
        }
        if (conflicting == null) {
            return decision;
        }
        log.info("merge.type_conflict mentionId={} key='{}' candidateType={} conflictingEntityId={} conflictingType={}",
                candidate.mentionId(), candidate.normalizedKey(), candidate.entityType(), conflicting,
                conflictingType);
        return ResolutionDecision.typeConflict(candidate, conflicting, decision.blockingKey(),
                "key '" + candidate.normalizedKey() + "' already names entity " + conflicting
                        + " of type " + conflictingType + ", candidate type is " + candidate.entityType());
    }

    private void recordMetrics(Candidate candidate, ResolutionDecision decision) {
        if (decision.isMerge()) {
            metricsService.incrementEntityMerged(candidate.entityType(), decision.tier());
        } else {
            metricsService.incrementEntityCreated(candidate.entityType());
            if (decision.tier() == DecisionTier.TYPE_CONFLICT) {
                metricsService.incrementTypeConflict(candidate.entityType());
            }
        }
    }

    private static void index(Map<String, Set<Integer>> index, String key, int id) {
        index.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(id);
    }
}
