package com.router.dto.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.router.model.Integration;
import java.util.List;

/**
 * First event of a session.
 */
@JsonPropertyOrder({"type", "query", "integrations", "max_steps"})
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetadataEvent(String query, List<Integration> integrations, int maxSteps) implements StreamEvent {

    @Override
    @JsonProperty("type")
    public String type() {
        return "metadata";
    }
}
