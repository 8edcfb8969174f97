package com.router.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.router.model.ExecutionOutcome;
import com.router.model.OperationDocument;

/**
 * Result of a single-step goal.
 * <p>
 * When no operation matched, {@code operation} and every execution field are {@code null};
 * the caller decides how to report it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ActionResult(
        String rephrasedQuery,
        OperationDocument operation,
        ObjectNode parameters,
        ObjectNode body,
        JsonNode response,
        Long apiLatencyMs,
        Long orchestrationLatencyMs,
        String naturalLanguageResponse) {

    public static ActionResult unresolved(String rephrasedQuery) {
        return new ActionResult(rephrasedQuery, null, null, null, null, null, null, null);
    }

    public static ActionResult of(String rephrasedQuery, OperationDocument operation, ExecutionOutcome outcome) {
        return new ActionResult(rephrasedQuery, operation, outcome.parameters(), outcome.body(), outcome.response(),
                outcome.apiLatencyMs(), outcome.orchestrationLatencyMs(), outcome.naturalLanguageResponse());
    }

    @JsonIgnore
    public boolean resolved() {
        return operation != null;
    }
}
