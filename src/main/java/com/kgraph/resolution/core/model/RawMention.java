package com.kgraph.resolution.core.model;

import java.util.Objects;

/**
 * One textual occurrence of an entity in one document, as produced by the
 * extraction gateway. Offsets are absolute character offsets into the document.
 *
 * <p>The mention id is derived from the document id and the span, so replaying
 * a document produces the same ids. Validation of the surface form is left to
 * the normalizer, which rejects unusable mentions.</p>
 *
 * @param mentionId    deterministic id ({@code documentId@start-end})
 * @param surfaceForm  the text as it appeared in the document
 * @param documentId   source document id
 * @param startOffset  inclusive start offset
 * @param endOffset    exclusive end offset
 * @param declaredType the type label declared by the extractor, may be null
 * @param context      surrounding text window, may be empty
 */
public record RawMention(
        String mentionId,
        String surfaceForm,
        String documentId,
        int startOffset,
        int endOffset,
        String declaredType,
        String context
) {
    public RawMention {
        Objects.requireNonNull(mentionId, "mentionId is required");
        Objects.requireNonNull(documentId, "documentId is required");
        context = context != null ? context : "";
    }

    public static RawMention of(String documentId, String surfaceForm, int startOffset, int endOffset,
                                String declaredType, String context) {
        return new RawMention(mentionId(documentId, startOffset, endOffset), surfaceForm, documentId,
                startOffset, endOffset, declaredType, context);
    }

    public static String mentionId(String documentId, int startOffset, int endOffset) {
        return documentId + "@" + startOffset + "-" + endOffset;
    }
}
