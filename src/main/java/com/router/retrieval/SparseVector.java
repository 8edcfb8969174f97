package com.router.retrieval;

import java.util.List;

/**
 * Sparse vector in the vector store's wire layout: parallel index and value lists.
 */
public record SparseVector(List<Integer> indices, List<Float> values) {

    public SparseVector {
        if (indices.size() != values.size()) {
            throw new IllegalArgumentException("indices and values differ in length");
        }
        indices = List.copyOf(indices);
        values = List.copyOf(values);
    }

    public boolean isEmpty() {
        return indices.isEmpty();
    }
}
