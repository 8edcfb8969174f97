package com.router.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.router.model.OperationDocument;

/**
 * Result of endpoint identification.
 *
 * @param endpoint       the chosen operation, {@code null} when the namespace yielded no candidate
 * @param address        base address joined with the operation path, {@code null} with the endpoint
 * @param rephrasedQuery the query used for retrieval
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IdentifiedEndpoint(OperationDocument endpoint, String address, String rephrasedQuery) {

    @JsonIgnore
    public boolean found() {
        return endpoint != null;
    }
}
