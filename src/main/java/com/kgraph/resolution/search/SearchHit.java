package com.kgraph.resolution.search;

import com.kgraph.resolution.core.model.EntityType;

import java.util.Set;

/**
 * One ranked entity in a search result.
 *
 * @param entityId    canonical entity id
 * @param label       primary label
 * @param type        entity type
 * @param score       combined relevance
 * @param hops        graph distance from the seed, 0 for a direct match
 * @param seedId      the directly matched entity this hit was reached from
 * @param documentIds documents mentioning the entity
 */
public record SearchHit(int entityId, String label, EntityType type, double score, int hops, int seedId,
                        Set<String> documentIds) {

    public SearchHit {
        documentIds = documentIds != null ? Set.copyOf(documentIds) : Set.of();
    }

    public SearchHit withScore(double newScore) {
        return new SearchHit(entityId, label, type, newScore, hops, seedId, documentIds);
    }

    public boolean isDirectMatch() {
        return hops == 0;
    }
}
