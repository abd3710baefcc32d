package com.kgraph.resolution.extraction;

/**
 * A slice of a document sent to the extractor in one call.
 *
 * @param documentId       the document the chunk belongs to
 * @param index            0-based position of the chunk in the document
 * @param text             the chunk text
 * @param startOffset      absolute offset of the first character in the document
 * @param nextStartOffset  absolute offset where the next chunk starts, or {@link #endOffset()} for the last chunk.
 *                         Text from here to the end of the chunk is repeated at the start of the next one.
 */
public record TextChunk(String documentId, int index, String text, int startOffset, int nextStartOffset) {

    public TextChunk {
        if (nextStartOffset <= startOffset || nextStartOffset > startOffset + text.length()) {
            throw new IllegalArgumentException("nextStartOffset must fall inside the chunk, got " + nextStartOffset);
        }
    }

    public int endOffset() {
        return startOffset + text.length();
    }

    /**
     * Whether a span starting at {@code absoluteStart} belongs to this chunk rather than the next one.
     */
    public boolean owns(int absoluteStart) {
        return absoluteStart < nextStartOffset;
    }
}
