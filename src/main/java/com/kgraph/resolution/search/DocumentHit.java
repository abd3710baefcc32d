package com.kgraph.resolution.search;

import java.util.List;

/**
 * A document ranked by the best entity hit mentioning it.
 *
 * @param documentId the document
 * @param score      score of the best hit mentioning it
 * @param entityIds  ids of the hits mentioning it, best first
 */
public record DocumentHit(String documentId, double score, List<Integer> entityIds) {

    public DocumentHit {
        entityIds = List.copyOf(entityIds);
    }
}
