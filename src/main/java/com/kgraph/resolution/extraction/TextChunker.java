package com.kgraph.resolution.extraction;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a document into chunks of at most {@code maxChunkChars} characters.
 *
 * <p>A chunk ends after the last sentence terminator in the second half of its window when there
 * is one, else at the last whitespace, else it is hard-cut. A chunk cut inside a sentence is
 * followed by one that starts up to {@code overlapChars} earlier, on a word boundary, so a name
 * split by the cut appears whole in the next chunk.</p>
 *
 * <p>Chunk offsets are absolute, so spans found in a chunk map back onto the document.</p>
 */
public class TextChunker {

    private final int maxChunkChars;
    private final int overlapChars;

    public TextChunker(int maxChunkChars) {
        this(maxChunkChars, 0);
    }

    public TextChunker(int maxChunkChars, int overlapChars) {
        if (maxChunkChars < 1) {
            throw new IllegalArgumentException("maxChunkChars must be >= 1");
        }
        if (overlapChars < 0 || overlapChars >= maxChunkChars) {
            throw new IllegalArgumentException("overlapChars must be in [0, maxChunkChars), got " + overlapChars);
        }
        this.maxChunkChars = maxChunkChars;
        this.overlapChars = overlapChars;
    }

    public List<TextChunk> chunk(String documentId, String text) {
        List<TextChunk> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }
        int length = text.length();
        int pos = skipWhitespace(text, 0);
        while (pos < length) {
            int end = Math.min(length, pos + maxChunkChars);
            boolean sentenceCut = false;
            if (end < length) {
                int cut = lastSentenceEnd(text, pos + maxChunkChars / 2, end);
                if (cut > pos) {
                    end = cut;
                    sentenceCut = true;
                } else if (!Character.isWhitespace(text.charAt(end))) {
                    cut = lastWhitespace(text, pos, end);
                    if (cut > pos) {
                        end = cut;
                    }
                }
            }
            int next;
            if (end >= length) {
                next = length;
            } else {
                next = skipWhitespace(text, sentenceCut ? end : overlapStart(text, pos, end));
            }
            int nextStart = Math.min(next, end);
            chunks.add(new TextChunk(documentId, chunks.size(), text.substring(pos, end), pos, nextStart));
            pos = next;
        }
        return chunks;
    }

    /**
     * First word start at or after {@code end - overlapChars}, never before {@code pos + 1}.
     */
    private int overlapStart(String text, int pos, int end) {
        int start = Math.max(pos + 1, end - overlapChars);
        while (start < end && !Character.isWhitespace(text.charAt(start - 1))) {
            start++;
        }
        return start;
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Offset just past the last {@code .}, {@code !} or {@code ?} in {@code [from, to)} that is followed by whitespace.
     */
    private static int lastSentenceEnd(String text, int from, int to) {
        for (int i = to; i > from; i--) {
            char c = text.charAt(i - 1);
            if ((c == '.' || c == '!' || c == '?') && Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }

    private static int lastWhitespace(String text, int from, int to) {
        for (int i = to - 1; i > from; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
