package com.router.retrieval;

import java.util.List;

/**
 * A text encoded into all three retrieval spaces.
 *
 * @param dense  pooled sentence vector
 * @param sparse BM25 term weights
 * @param late   per-token vectors
 */
public record Embeddings(float[] dense, SparseVector sparse, List<float[]> late) {

    public int denseDimension() {
        return dense.length;
    }

    public int lateDimension() {
        return late.isEmpty() ? dense.length : late.get(0).length;
    }
}
