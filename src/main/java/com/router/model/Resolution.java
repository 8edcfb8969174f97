package com.router.model;

import java.util.Optional;

/**
 * Result of endpoint resolution: the query actually used for retrieval and the chosen operation,
 * if retrieval produced any candidate.
 *
 * @param rephrasedQuery the query after optional rephrasing
 * @param document       the chosen operation, {@code null} when retrieval was empty
 */
public record Resolution(String rephrasedQuery, OperationDocument document) {

    public static Resolution none(String rephrasedQuery) {
        return new Resolution(rephrasedQuery, null);
    }

    public Optional<OperationDocument> operation() {
        return Optional.ofNullable(document);
    }
}
