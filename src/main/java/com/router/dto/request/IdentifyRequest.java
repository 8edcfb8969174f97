package com.router.dto.request;

import com.router.model.ModelConfig;

/**
 * Asks which operation of a namespace serves a query, without executing it.
 */
public record IdentifyRequest(
        String namespace,
        String baseAddress,
        String query,
        boolean rephrase,
        String rephraseInstructions,
        ModelConfig model) {
}
