package com.kgraph.resolution.extraction;

import com.kgraph.resolution.core.model.RawMention;

import java.time.Duration;
import java.util.List;

/**
 * Result of extracting one chunk. Failed and timed-out chunks carry no mentions.
 *
 * @param documentId the document
 * @param chunkIndex position of the chunk in the document
 * @param status     how the chunk ended
 * @param mentions   mentions with absolute offsets
 * @param relations  relations between those mentions
 * @param duration   time spent on the chunk
 * @param error      failure description, null on success
 */
public record ChunkOutcome(
        String documentId,
        int chunkIndex,
        ChunkStatus status,
        List<RawMention> mentions,
        List<MentionRelation> relations,
        Duration duration,
        String error
) {
    public ChunkOutcome {
        mentions = mentions != null ? List.copyOf(mentions) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
    }

    public static ChunkOutcome succeeded(TextChunk chunk, List<RawMention> mentions,
                                         List<MentionRelation> relations, Duration duration) {
        return new ChunkOutcome(chunk.documentId(), chunk.index(), ChunkStatus.SUCCEEDED,
                mentions, relations, duration, null);
    }

    public static ChunkOutcome failed(TextChunk chunk, Duration duration, String error) {
        return new ChunkOutcome(chunk.documentId(), chunk.index(), ChunkStatus.FAILED,
                List.of(), List.of(), duration, error);
    }

    public static ChunkOutcome timedOut(TextChunk chunk, Duration duration) {
        return new ChunkOutcome(chunk.documentId(), chunk.index(), ChunkStatus.TIMED_OUT,
                List.of(), List.of(), duration, "chunk timed out after " + duration.toMillis() + "ms");
    }

    public boolean isSuccess() {
        return status == ChunkStatus.SUCCEEDED;
    }
}
