package com.kgraph.resolution.merge;

import com.kgraph.resolution.core.model.EntityType;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entity records indexed by stable int id, plus a parent index from merged ids to the
 * id they were merged into (union-find). Roots have no parent entry.
 *
 * <p>{@link #allocate} and {@link #root(int)} may be called from any thread; {@code root} never
 * compresses paths. {@link #find} and {@link #union} need the merge engine's exclusive lock.</p>
 */
final class EntityArena {

    private final Map<Integer, EntityRecord> records = new ConcurrentHashMap<>();
    private final Map<Integer, Integer> parent = new ConcurrentHashMap<>();
    private final AtomicInteger nextId = new AtomicInteger(1);

    EntityRecord allocate(EntityType type) {
        int id = nextId.getAndIncrement();
        EntityRecord record = new EntityRecord(id, type);
        records.put(id, record);
        return record;
    }

    boolean contains(int id) {
        return records.containsKey(id);
    }

    EntityRecord record(int id) {
        EntityRecord record = records.get(id);
        if (record == null) {
            throw new RegistryCorruptionException("No entity record for id " + id);
        }
        return record;
    }

    /**
     * Root of {@code id}, compressing the path on the way.
     */
    int find(int id) {
        int root = root(id);
        int current = id;
        while (current != root) {
            Integer next = parent.get(current);
            parent.put(current, root);
            current = next;
        }
        return root;
    }

    /**
     * Root of {@code id} without modifying the index.
     *
     * @throws RegistryCorruptionException on a cycle or a dangling parent
     */
    int root(int id) {
        if (!records.containsKey(id)) {
            throw new RegistryCorruptionException("Unknown entity id " + id);
        }
        int current = id;
        int limit = records.size() + 1;
        for (int steps = 0; steps <= limit; steps++) {
            Integer next = parent.get(current);
            if (next == null) {
                return current;
            }
            if (!records.containsKey(next)) {
                throw new RegistryCorruptionException("Entity " + current + " has dangling parent " + next);
            }
            current = next;
        }
        throw new RegistryCorruptionException("Cycle in parent index starting at entity " + id);
    }

    /**
     * Points root {@code source} at root {@code target}.
     */
    void union(int source, int target) {
        if (parent.containsKey(source) || parent.containsKey(target)) {
            throw new IllegalArgumentException("union requires two roots, got " + source + " and " + target);
        }
        if (source == target) {
            return;
        }
        parent.put(source, target);
    }

    boolean isRoot(int id) {
        return records.containsKey(id) && !parent.containsKey(id);
    }

    int size() {
        return records.size();
    }

    /**
     * Test hook for corrupting the parent index.
     */
    void forceParent(int id, int parentId) {
        parent.put(id, parentId);
    }
}
