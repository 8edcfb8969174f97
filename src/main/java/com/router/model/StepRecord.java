package com.router.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The outcome of one executed step, kept in an {@link ExecutionContext}.
 *
 * @param stepNumber  1-based index within the session
 * @param stepText    the executed instruction
 * @param namespace   the namespace it ran against
 * @param rawResponse the unmodified remote response
 * @param reasoning   the planner's reasoning for the step
 * @param guideUsed   whether a usage guide was available for the namespace
 */
public record StepRecord(
        int stepNumber,
        String stepText,
        String namespace,
        JsonNode rawResponse,
        String reasoning,
        boolean guideUsed) {
}
