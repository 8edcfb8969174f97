package com.router.dto.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.router.dto.response.ActionResult;

/**
 * Emitted after a step was executed, carrying the single-step result.
 */
@JsonPropertyOrder({"type", "step_number", "step", "integration_id", "integration_name", "response",
        "natural_language_response", "manual_used", "reasoning"})
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StepCompleteEvent(
        int stepNumber,
        String step,
        String integrationId,
        String integrationName,
        ActionResult response,
        String naturalLanguageResponse,
        boolean manualUsed,
        String reasoning) implements StreamEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "step_complete";
    }
}
