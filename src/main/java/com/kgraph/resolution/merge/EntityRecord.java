package com.kgraph.resolution.merge;

import com.kgraph.resolution.core.model.Candidate;
import com.kgraph.resolution.core.model.CanonicalEntity;
import com.kgraph.resolution.core.model.EntityType;
import com.kgraph.resolution.core.model.Provenance;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Live, mutable state of one canonical entity. Owned by the {@link EntityArena};
 * only mutated under the merge engine's write lock and published as {@link CanonicalEntity} snapshots.
 */
final class EntityRecord {

    private final int id;
    private final EntityType type;
    private final Map<String, Integer> aliasFrequencies = new LinkedHashMap<>();
    private final Set<String> aliasKeys = new LinkedHashSet<>();
    private final Set<String> blockingKeys = new LinkedHashSet<>();
    private final List<Provenance> provenance = new ArrayList<>();
    private final Set<Integer> mergedEntityIds = new TreeSet<>();
    private final Instant createdAt;
    private String primaryLabel;
    private long version;
    private Instant updatedAt;

    EntityRecord(int id, EntityType type) {
        this.id = id;
        this.type = type;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    int id() {
        return id;
    }

    EntityType type() {
        return type;
    }

    Set<String> aliasKeys() {
        return aliasKeys;
    }

    Set<String> blockingKeys() {
        return blockingKeys;
    }

    /**
     * Records one more mention of this entity.
     */
    void addMention(Candidate candidate, String blockingKey) {
        aliasFrequencies.merge(candidate.surfaceForm(), 1, Integer::sum);
        aliasKeys.add(candidate.normalizedKey());
        blockingKeys.add(blockingKey);
        provenance.add(Provenance.of(candidate.mention()));
        touch();
    }

    /**
     * Takes over everything another entity knows. The other record is left untouched.
     */
    void absorb(EntityRecord other) {
        other.aliasFrequencies.forEach((alias, count) -> aliasFrequencies.merge(alias, count, Integer::sum));
        aliasKeys.addAll(other.aliasKeys);
        blockingKeys.addAll(other.blockingKeys);
        provenance.addAll(other.provenance);
        mergedEntityIds.add(other.id);
        mergedEntityIds.addAll(other.mergedEntityIds);
        touch();
    }

    private void touch() {
        primaryLabel = chooseLabel(aliasFrequencies);
        version++;
        updatedAt = Instant.now();
    }

    /**
     * Most frequent alias; ties go to the longest form, then to the lexicographically smallest.
     */
    static String chooseLabel(Map<String, Integer> frequencies) {
        String best = null;
        int bestCount = -1;
        for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
            String alias = entry.getKey();
            int count = entry.getValue();
            if (best == null
                    || count > bestCount
                    || (count == bestCount && alias.length() > best.length())
                    || (count == bestCount && alias.length() == best.length() && alias.compareTo(best) < 0)) {
                best = alias;
                bestCount = count;
            }
        }
        return best;
    }

    CanonicalEntity snapshot() {
        return CanonicalEntity.builder()
                .id(id)
                .type(type)
                .primaryLabel(primaryLabel)
                .aliasFrequencies(aliasFrequencies)
                .aliasKeys(aliasKeys)
                .provenance(provenance)
                .mergedEntityIds(mergedEntityIds)
                .version(version)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
