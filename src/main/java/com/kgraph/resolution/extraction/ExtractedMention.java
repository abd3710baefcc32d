package com.kgraph.resolution.extraction;

/**
 * An entity span returned by an {@link ExtractionCapability}.
 * Offsets are relative to the text passed to {@code extract}.
 *
 * @param surfaceForm the span text
 * @param label       the extractor's type label, may be null
 * @param start       inclusive start offset
 * @param end         exclusive end offset
 */
public record ExtractedMention(String surfaceForm, String label, int start, int end) {
}
