package com.kgraph.resolution.extraction;

import java.util.List;

/**
 * Output of one {@link ExtractionCapability#extract(String)} call.
 */
public record ExtractionResult(List<ExtractedMention> mentions, List<ExtractedRelation> relations) {

    public ExtractionResult {
        mentions = mentions != null ? List.copyOf(mentions) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of());
    }
}
