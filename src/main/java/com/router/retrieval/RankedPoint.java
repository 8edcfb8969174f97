package com.router.retrieval;

import java.util.Map;

/**
 * One hit of a single-space nearest-neighbour search, in rank order of its list.
 */
public record RankedPoint(String pointId, double score, Map<String, Object> payload) {

    public RankedPoint {
        payload = payload == null ? Map.of() : payload;
    }
}
