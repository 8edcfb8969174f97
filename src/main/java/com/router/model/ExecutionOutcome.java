package com.router.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * What the executor did for one operation.
 *
 * @param parameters              extracted request parameters
 * @param body                    extracted request body
 * @param response                remote response body, unmodified
 * @param apiLatencyMs            time spent inside the remote call
 * @param orchestrationLatencyMs  time spent in extraction and request preparation
 * @param naturalLanguageResponse prose summary, {@code null} unless requested
 */
public record ExecutionOutcome(
        ObjectNode parameters,
        ObjectNode body,
        JsonNode response,
        long apiLatencyMs,
        long orchestrationLatencyMs,
        String naturalLanguageResponse) {
}
