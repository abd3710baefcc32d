package com.kgraph.resolution.extraction;

/**
 * A relation returned by an {@link ExtractionCapability}, referencing two mentions
 * of the same result by their index.
 *
 * @param subjectIndex index of the subject in {@link ExtractionResult#mentions()}
 * @param predicate    relation label as produced by the extractor
 * @param objectIndex  index of the object in {@link ExtractionResult#mentions()}
 */
public record ExtractedRelation(int subjectIndex, String predicate, int objectIndex) {
}
