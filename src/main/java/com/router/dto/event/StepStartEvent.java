package com.router.dto.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Emitted before a step is executed.
 */
@JsonPropertyOrder({"type", "step_number", "step", "integration_id", "integration_name", "reasoning"})
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StepStartEvent(
        int stepNumber,
        String step,
        String integrationId,
        String integrationName,
        String reasoning) implements StreamEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "step_start";
    }
}
