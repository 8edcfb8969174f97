package com.router.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.router.model.Integration;
import java.util.List;

/**
 * A static decomposition: ordered steps, each assigned to one integration.
 *
 * @param steps        the planned steps
 * @param integrations the integrations the planner chose from
 * @param query        the goal as submitted
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GeneratedSteps(List<PlannedStep> steps, List<Integration> integrations, String query) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PlannedStep(String step, String integrationId) {
    }
}
