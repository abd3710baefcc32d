package com.kgraph.resolution.api;

import java.util.Objects;

/**
 * A non-fatal problem met while ingesting a document.
 *
 * @param kind   what went wrong
 * @param detail description, including the chunk, mention or relation concerned
 */
public record IngestionError(Kind kind, String detail) {

    public enum Kind {
        /** A chunk failed or timed out; its mentions were skipped. */
        EXTRACTION_FAILED,
        /** A mention was rejected by the normalizer. */
        MALFORMED_MENTION,
        /** A mention could not be resolved. */
        RESOLUTION_FAILED,
        /** A relation referenced an unresolved mention or had an unusable label. */
        RELATION_DROPPED,
        /** A graph store write failed after retries. */
        GRAPH_WRITE_FAILED
    }

    public IngestionError {
        Objects.requireNonNull(kind, "kind is required");
    }
}
