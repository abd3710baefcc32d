package com.kgraph.resolution.graph;

import com.kgraph.resolution.core.model.CanonicalEntity;
import com.kgraph.resolution.core.model.Relation;
import com.kgraph.resolution.merge.MergeEngine;
import com.kgraph.resolution.merge.MergeListener;
import com.kgraph.resolution.retry.Retrier;
import com.kgraph.resolution.retry.RetryExhaustedException;
import com.kgraph.resolution.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Materializes canonical entities and relations into a {@link GraphStore}.
 *
 * <p>Node writes are ordered per entity by version: a snapshot not newer than the last one
 * written is ignored. A relation whose endpoint node is not materialized yet waits in a
 * {@link PendingRelationQueue} and is written when that node appears. Edges are keyed by
 * {@code (from, predicate, to)} after re-rooting, so a replayed relation never creates a second edge.</p>
 *
 * <p>Entity unions arrive through {@link MergeListener#onEntitiesMerged}: the absorbed node is marked
 * with {@code mergedInto}, and each of its edges is written again on the surviving entity and then
 * deleted.</p>
 */
public class GraphBuilder implements MergeListener {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private static final int LOCK_STRIPES = 64;

    /**
     * What {@link #materialize(Relation)} did with a relation.
     */
    public enum RelationStatus {
        MATERIALIZED,
        ALREADY_MATERIALIZED,
        PENDING,
        SELF_LOOP
    }

    private final GraphStore store;
    private final MergeEngine registry;
    private final Retrier retrier;
    private final Map<Integer, Long> nodeVersions = new ConcurrentHashMap<>();
    private final Set<String> edgeKeys = ConcurrentHashMap.newKeySet();
    private final Map<Integer, Set<Relation>> edgesByNode = new ConcurrentHashMap<>();
    private final PendingRelationQueue pending = new PendingRelationQueue();
    private final Object pendingLock = new Object();
    private final Object[] nodeLocks = new Object[LOCK_STRIPES];
    private final Map<Integer, Integer> unfinishedUnions = Collections.synchronizedMap(new LinkedHashMap<>());

    public GraphBuilder(GraphStore store, MergeEngine registry) {
        this(store, registry, new Retrier(RetryPolicy.defaults()));
    }

    public GraphBuilder(GraphStore store, MergeEngine registry, Retrier retrier) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.retrier = Objects.requireNonNull(retrier, "retrier is required");
        for (int i = 0; i < LOCK_STRIPES; i++) {
            nodeLocks[i] = new Object();
        }
    }

    /**
     * Upserts the entity's node, then writes the relations that were waiting for it.
     *
     * @return true if the node was written, false if this version (or a newer one) already was
     * @throws GraphWriteException if a store write failed for good
     */
    public boolean materialize(CanonicalEntity entity) {
        int id = entity.getId();
        boolean written;
        synchronized (nodeLocks[Math.floorMod(id, LOCK_STRIPES)]) {
            Long version = nodeVersions.get(id);
            written = version == null || version < entity.getVersion();
            if (written) {
                write("graph.upsertNode", () -> store.upsertNode(id, nodeAttributes(entity)));
                nodeVersions.put(id, entity.getVersion());
                log.debug("graph.node.upserted entityId={} version={} label='{}'",
                        id, entity.getVersion(), entity.getPrimaryLabel());
            } else {
                log.trace("graph.node.unchanged entityId={} version={}", id, entity.getVersion());
            }
        }
        // relations re-queued after a failed edge write are retried even when the node is unchanged
        flushPending(id);
        return written;
    }

    /**
     * Writes a relation between the current roots of its endpoints, or queues it until both
     * endpoint nodes are materialized.
     *
     * @throws GraphWriteException if the edge write failed for good
     */
    public RelationStatus materialize(Relation relation) {
        int subject = registry.resolveId(relation.subjectEntityId());
        int object = registry.resolveId(relation.objectEntityId());
        Relation rooted = relation.withEndpoints(subject, object);
        if (subject == object) {
            log.debug("graph.edge.self_loop edge={}", rooted.edgeKey());
            return RelationStatus.SELF_LOOP;
        }
        if (edgeKeys.contains(rooted.edgeKey())) {
            return RelationStatus.ALREADY_MATERIALIZED;
        }

        synchronized (pendingLock) {
            Integer missing = !nodeVersions.containsKey(subject) ? Integer.valueOf(subject)
                    : !nodeVersions.containsKey(object) ? Integer.valueOf(object) : null;
            if (missing != null) {
                if (pending.enqueue(missing, rooted)) {
                    log.debug("graph.edge.pending edge={} waitingFor={}", rooted.edgeKey(), missing);
                }
                return RelationStatus.PENDING;
            }
        }

        if (!edgeKeys.add(rooted.edgeKey())) {
            return RelationStatus.ALREADY_MATERIALIZED;
        }
        try {
            write("graph.upsertEdge", () -> store.upsertEdge(subject, object, rooted.predicate(),
                    Map.of("provenance", List.copyOf(rooted.provenanceMentionIds()))));
        } catch (GraphWriteException e) {
            edgeKeys.remove(rooted.edgeKey());
            throw e;
        }
        edgesByNode.computeIfAbsent(subject, k -> ConcurrentHashMap.newKeySet()).add(rooted);
        edgesByNode.computeIfAbsent(object, k -> ConcurrentHashMap.newKeySet()).add(rooted);
        log.debug("graph.edge.upserted edge={}", rooted.edgeKey());
        return RelationStatus.MATERIALIZED;
    }

    /**
     * Moves the absorbed entity's graph state to the survivor. A store failure does not reach the
     * merge engine: the union is kept and re-applied by {@link #repairUnions()}.
     *
     * @throws com.kgraph.resolution.merge.RegistryCorruptionException if the registry cannot resolve an endpoint
     */
    @Override
    public void onEntitiesMerged(int sourceEntityId, CanonicalEntity target) {
        int targetId = target.getId();
        log.info("graph.union sourceEntityId={} targetEntityId={}", sourceEntityId, targetId);
        try {
            applyUnion(sourceEntityId, target);
        } catch (GraphWriteException e) {
            unfinishedUnions.put(sourceEntityId, targetId);
            log.warn("graph.union.deferred sourceEntityId={} targetEntityId={} error={}",
                    sourceEntityId, targetId, e.getMessage());
        }
    }

    /**
     * Re-applies unions whose graph writes failed.
     *
     * @return number of unions still unfinished
     */
    public int repairUnions() {
        Map<Integer, Integer> retry;
        synchronized (unfinishedUnions) {
            if (unfinishedUnions.isEmpty()) {
                return 0;
            }
            retry = new LinkedHashMap<>(unfinishedUnions);
            unfinishedUnions.clear();
        }
        log.debug("graph.union.repair unions={}", retry.size());
        retry.forEach((source, target) -> registry.getEntity(target)
                .ifPresent(survivor -> onEntitiesMerged(source, survivor)));
        return unfinishedUnions.size();
    }

    private void applyUnion(int sourceEntityId, CanonicalEntity target) {
        int targetId = target.getId();
        materialize(target);

        if (nodeVersions.containsKey(sourceEntityId)) {
            write("graph.upsertNode", () -> store.upsertNode(sourceEntityId, Map.of("mergedInto", targetId)));
        }
        synchronized (pendingLock) {
            pending.rekey(sourceEntityId, targetId);
        }
        flushPending(targetId);

        Set<Relation> moved = edgesByNode.get(sourceEntityId);
        if (moved != null) {
            for (Relation relation : List.copyOf(moved)) {
                materialize(relation);
                retire(relation);
            }
            if (moved.isEmpty()) {
                edgesByNode.remove(sourceEntityId);
            }
        }
    }

    /**
     * Deletes an edge written between endpoints that are no longer both roots.
     */
    private void retire(Relation relation) {
        write("graph.removeEdge", () -> store.removeEdge(relation.subjectEntityId(), relation.objectEntityId(),
                relation.predicate()));
        edgeKeys.remove(relation.edgeKey());
        for (int endpoint : new int[]{relation.subjectEntityId(), relation.objectEntityId()}) {
            Set<Relation> relations = edgesByNode.get(endpoint);
            if (relations != null) {
                relations.remove(relation);
            }
        }
        log.debug("graph.edge.retired edge={}", relation.edgeKey());
    }

    public boolean isMaterialized(int entityId) {
        return nodeVersions.containsKey(entityId);
    }

    public int pendingCount() {
        return pending.size();
    }

    public List<Relation> pendingFor(int entityId) {
        return pending.pendingFor(entityId);
    }

    public int unfinishedUnionCount() {
        return unfinishedUnions.size();
    }

    public int materializedEdgeCount() {
        return edgeKeys.size();
    }

    public GraphStore getStore() {
        return store;
    }

    private void flushPending(int entityId) {
        List<Relation> waiting;
        synchronized (pendingLock) {
            waiting = pending.drain(entityId);
        }
        if (waiting.isEmpty()) {
            return;
        }
        log.debug("graph.pending.flush entityId={} relations={}", entityId, waiting.size());
        GraphWriteException failure = null;
        List<Relation> failed = new ArrayList<>();
        for (Relation relation : waiting) {
            try {
                materialize(relation);
            } catch (GraphWriteException e) {
                failed.add(relation);
                if (failure == null) {
                    failure = e;
                }
            }
        }
        if (failure != null) {
            synchronized (pendingLock) {
                for (Relation relation : failed) {
                    pending.enqueue(entityId, relation);
                }
            }
            throw failure;
        }
    }

    private void write(String operation, Runnable action) {
        try {
            retrier.run(operation, action);
        } catch (RetryExhaustedException e) {
            throw new GraphWriteException(operation, e.getCause());
        } catch (RuntimeException e) {
            throw new GraphWriteException(operation, e);
        }
    }

    static Map<String, Object> nodeAttributes(CanonicalEntity entity) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("type", entity.getType().name());
        attributes.put("label", entity.getPrimaryLabel());
        attributes.put("aliases", List.copyOf(entity.getAliases()));
        attributes.put("mentionCount", entity.getMentionCount());
        attributes.put("documents", List.copyOf(entity.getDocumentIds()));
        attributes.put("version", entity.getVersion());
        return attributes;
    }
}
