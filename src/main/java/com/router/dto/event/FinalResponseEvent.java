package com.router.dto.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.router.model.TerminationReason;
import java.util.List;

/**
 * The answer synthesized from every executed step, and why the loop stopped.
 * {@code truncated} is set only when the iteration cap ended the session.
 */
@JsonPropertyOrder({"type", "final_response", "natural_language_response", "total_steps", "executed_steps",
        "termination", "truncated"})
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FinalResponseEvent(
        String finalResponse,
        String naturalLanguageResponse,
        int totalSteps,
        List<ExecutedStep> executedSteps,
        TerminationReason termination,
        boolean truncated) implements StreamEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "final_response";
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExecutedStep(String step, String integrationId) {
    }
}
