package com.kgraph.resolution.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable snapshot of a canonical entity: the deduplicated, authoritative
 * representation of a real-world entity across all ingested documents.
 *
 * <p>Snapshots are produced by the merge engine; the live state is owned by the
 * registry and only ever grows (aliases, frequencies, provenance).</p>
 */
public class CanonicalEntity {
    private final int id;
    private final EntityType type;
    private final String primaryLabel;
    private final Map<String, Integer> aliasFrequencies;
    private final Set<String> aliasKeys;
    private final List<Provenance> provenance;
    private final Set<Integer> mergedEntityIds;
    private final long version;
    private final Instant createdAt;
    private final Instant updatedAt;

    private CanonicalEntity(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.primaryLabel = builder.primaryLabel;
        this.aliasFrequencies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.aliasFrequencies));
        this.aliasKeys = Collections.unmodifiableSet(new LinkedHashSet<>(builder.aliasKeys));
        this.provenance = List.copyOf(builder.provenance);
        this.mergedEntityIds = Collections.unmodifiableSet(new TreeSet<>(builder.mergedEntityIds));
        this.version = builder.version;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public int getId() {
        return id;
    }

    public EntityType getType() {
        return type;
    }

    public String getPrimaryLabel() {
        return primaryLabel;
    }

    /**
     * Gets every surface form that resolved to this entity.
     */
    public Set<String> getAliases() {
        return aliasFrequencies.keySet();
    }

    /**
     * Gets the mention count per surface form.
     */
    public Map<String, Integer> getAliasFrequencies() {
        return aliasFrequencies;
    }

    /**
     * Gets the normalized comparison keys of all aliases.
     */
    public Set<String> getAliasKeys() {
        return aliasKeys;
    }

    public int getFrequency(String alias) {
        return aliasFrequencies.getOrDefault(alias, 0);
    }

    /**
     * Total number of mentions resolved to this entity.
     */
    public int getMentionCount() {
        int total = 0;
        for (int count : aliasFrequencies.values()) {
            total += count;
        }
        return total;
    }

    public List<Provenance> getProvenance() {
        return provenance;
    }

    /**
     * Gets the distinct ids of documents that mention this entity, in first-seen order.
     */
    public Set<String> getDocumentIds() {
        Set<String> documents = new LinkedHashSet<>();
        for (Provenance p : provenance) {
            documents.add(p.documentId());
        }
        return documents;
    }

    /**
     * Gets the ids of canonical entities that were merged into this one.
     */
    public Set<Integer> getMergedEntityIds() {
        return mergedEntityIds;
    }

    /**
     * Monotonic version, incremented on every change to the live record.
     */
    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalEntity that = (CanonicalEntity) o;
        return id == that.id && version == that.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "CanonicalEntity{" +
                "id=" + id +
                ", type=" + type +
                ", primaryLabel='" + primaryLabel + '\'' +
                ", aliases=" + aliasFrequencies +
                ", version=" + version +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int id;
        private EntityType type;
        private String primaryLabel;
        private Map<String, Integer> aliasFrequencies = new LinkedHashMap<>();
        private Set<String> aliasKeys = new LinkedHashSet<>();
        private List<Provenance> provenance = new ArrayList<>();
        private Set<Integer> mergedEntityIds = new TreeSet<>();
        private long version;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder primaryLabel(String primaryLabel) {
            this.primaryLabel = primaryLabel;
            return this;
        }

        public Builder aliasFrequencies(Map<String, Integer> aliasFrequencies) {
            this.aliasFrequencies = aliasFrequencies;
            return this;
        }

        public Builder aliasKeys(Set<String> aliasKeys) {
            this.aliasKeys = aliasKeys;
            return this;
        }

        public Builder provenance(List<Provenance> provenance) {
            this.provenance = provenance;
            return this;
        }

        public Builder mergedEntityIds(Set<Integer> mergedEntityIds) {
            this.mergedEntityIds = mergedEntityIds;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public CanonicalEntity build() {
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(primaryLabel, "primaryLabel is required");
            return new CanonicalEntity(this);
        }
    }
}
