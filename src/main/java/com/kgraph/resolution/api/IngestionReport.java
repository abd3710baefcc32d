package com.kgraph.resolution.api;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-document summary of an ingestion. Non-fatal errors are collected in {@link #getErrors()}
 * instead of failing the ingestion.
 */
public class IngestionReport {
    private final String documentId;
    private final int mentionsExtracted;
    private final int mentionsMerged;
    private final int mentionsCreated;
    private final int mentionsReplayed;
    private final int mentionsMalformed;
    private final int typeConflicts;
    private final int lowConfidenceMerges;
    private final int relationsMaterialized;
    private final int relationsPending;
    private final int chunksTotal;
    private final int chunksFailed;
    private final boolean partiallyMaterialized;
    private final List<IngestionError> errors;
    private final Duration duration;

    private IngestionReport(Builder builder) {
        this.documentId = Objects.requireNonNull(builder.documentId, "documentId is required");
        this.mentionsExtracted = builder.mentionsExtracted;
        this.mentionsMerged = builder.mentionsMerged;
        this.mentionsCreated = builder.mentionsCreated;
        this.mentionsReplayed = builder.mentionsReplayed;
        this.mentionsMalformed = builder.mentionsMalformed;
        this.typeConflicts = builder.typeConflicts;
        this.lowConfidenceMerges = builder.lowConfidenceMerges;
        this.relationsMaterialized = builder.relationsMaterialized;
        this.relationsPending = builder.relationsPending;
        this.chunksTotal = builder.chunksTotal;
        this.chunksFailed = builder.chunksFailed;
        this.partiallyMaterialized = builder.partiallyMaterialized;
        this.errors = List.copyOf(builder.errors);
        this.duration = builder.duration != null ? builder.duration : Duration.ZERO;
    }

    public String getDocumentId() {
        return documentId;
    }

    public int getMentionsExtracted() {
        return mentionsExtracted;
    }

    public int getMentionsMerged() {
        return mentionsMerged;
    }

    public int getMentionsCreated() {
        return mentionsCreated;
    }

    /**
     * Mentions that had already been applied by an earlier ingestion of the same document.
     */
    public int getMentionsReplayed() {
        return mentionsReplayed;
    }

    public int getMentionsMalformed() {
        return mentionsMalformed;
    }

    public int getTypeConflicts() {
        return typeConflicts;
    }

    public int getLowConfidenceMerges() {
        return lowConfidenceMerges;
    }

    public int getRelationsMaterialized() {
        return relationsMaterialized;
    }

    /**
     * Relations queued because an endpoint node was not materialized yet.
     */
    public int getRelationsPending() {
        return relationsPending;
    }

    public int getChunksTotal() {
        return chunksTotal;
    }

    public int getChunksFailed() {
        return chunksFailed;
    }

    /**
     * True when some graph write failed for good: the registry holds the document's
     * entities but the graph store does not fully reflect them.
     */
    public boolean isPartiallyMaterialized() {
        return partiallyMaterialized;
    }

    public List<IngestionError> getErrors() {
        return errors;
    }

    public List<IngestionError> getErrors(IngestionError.Kind kind) {
        return errors.stream().filter(e -> e.kind() == kind).toList();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return "IngestionReport{" +
                "documentId='" + documentId + '\'' +
                ", mentionsExtracted=" + mentionsExtracted +
                ", mentionsMerged=" + mentionsMerged +
                ", mentionsCreated=" + mentionsCreated +
                ", mentionsReplayed=" + mentionsReplayed +
                ", mentionsMalformed=" + mentionsMalformed +
                ", chunksFailed=" + chunksFailed + "/" + chunksTotal +
                ", relationsMaterialized=" + relationsMaterialized +
                ", relationsPending=" + relationsPending +
                ", partiallyMaterialized=" + partiallyMaterialized +
                ", errors=" + errors.size() +
                '}';
    }

    public static Builder builder(String documentId) {
        return new Builder(documentId);
    }

    /**
     * Accumulates counts while a document is ingested. Not thread-safe.
     */
    public static class Builder {
        private final String documentId;
        private int mentionsExtracted;
        private int mentionsMerged;
        private int mentionsCreated;
        private int mentionsReplayed;
        private int mentionsMalformed;
        private int typeConflicts;
        private int lowConfidenceMerges;
        private int relationsMaterialized;
        private int relationsPending;
        private int chunksTotal;
        private int chunksFailed;
        private boolean partiallyMaterialized;
        private final List<IngestionError> errors = new ArrayList<>();
        private Duration duration;

        private Builder(String documentId) {
            this.documentId = documentId;
        }

        public Builder mentionsExtracted(int count) {
            this.mentionsExtracted += count;
            return this;
        }

        public Builder mentionMerged() {
            this.mentionsMerged++;
            return this;
        }

        public Builder mentionCreated() {
            this.mentionsCreated++;
            return this;
        }

        public Builder mentionReplayed() {
            this.mentionsReplayed++;
            return this;
        }

        public Builder mentionMalformed() {
            this.mentionsMalformed++;
            return this;
        }

        public Builder typeConflict() {
            this.typeConflicts++;
            return this;
        }

        public Builder lowConfidenceMerge() {
            this.lowConfidenceMerges++;
            return this;
        }

        public Builder relationMaterialized() {
            this.relationsMaterialized++;
            return this;
        }

        public Builder relationPending() {
            this.relationsPending++;
            return this;
        }

        public Builder chunksTotal(int count) {
            this.chunksTotal = count;
            return this;
        }

        public Builder chunkFailed() {
            this.chunksFailed++;
            return this;
        }

        public Builder partiallyMaterialized() {
            this.partiallyMaterialized = true;
            return this;
        }

        public Builder error(IngestionError.Kind kind, String detail) {
            this.errors.add(new IngestionError(kind, detail));
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public IngestionReport build() {
            return new IngestionReport(this);
        }
    }
}
