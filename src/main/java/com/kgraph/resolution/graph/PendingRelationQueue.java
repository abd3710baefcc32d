package com.kgraph.resolution.graph;

import com.kgraph.resolution.core.model.Relation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Relations waiting for an endpoint node to be materialized, keyed by the missing entity id.
 * Each queued relation is handed out by {@link #drain(int)} exactly once.
 */
public class PendingRelationQueue {

    private final Map<Integer, List<Relation>> pending = new HashMap<>();
    private int size;

    /**
     * Queues a relation under the entity it waits for.
     *
     * @return false if a relation with the same edge key is already waiting for that entity
     */
    public synchronized boolean enqueue(int missingEntityId, Relation relation) {
        List<Relation> waiting = pending.computeIfAbsent(missingEntityId, k -> new ArrayList<>());
        for (Relation queued : waiting) {
            if (queued.edgeKey().equals(relation.edgeKey())) {
                return false;
            }
        }
        waiting.add(relation);
        size++;
        return true;
    }

    /**
     * Removes and returns the relations waiting for {@code entityId}.
     */
    public synchronized List<Relation> drain(int entityId) {
        List<Relation> relations = pending.remove(entityId);
        if (relations == null) {
            return List.of();
        }
        size -= relations.size();
        return relations;
    }

    /**
     * Moves the relations waiting for {@code fromId} under {@code toId}, after the two entities merged.
     */
    public synchronized void rekey(int fromId, int toId) {
        List<Relation> relations = pending.remove(fromId);
        if (relations == null) {
            return;
        }
        size -= relations.size();
        for (Relation relation : relations) {
            enqueue(toId, relation);
        }
    }

    public synchronized List<Relation> pendingFor(int entityId) {
        return List.copyOf(pending.getOrDefault(entityId, List.of()));
    }

    public synchronized int size() {
        return size;
    }
}
