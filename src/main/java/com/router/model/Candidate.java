package com.router.model;

import java.util.Map;

/**
 * A document returned by fused retrieval. Ephemeral: lives for one resolution.
 *
 * @param pointId document-store identifier, also the fusion tie-breaker
 * @param payload the metadata stored with the document
 * @param score   fused reciprocal-rank score
 * @param rank    1-based position in the fused list
 */
public record Candidate(String pointId, Map<String, Object> payload, double score, int rank) {

    public Candidate {
        payload = payload == null ? Map.of() : payload;
    }
}
