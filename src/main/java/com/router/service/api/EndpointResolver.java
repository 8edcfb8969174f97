package com.router.service.api;

import com.router.model.ModelConfig;
import com.router.model.Resolution;

public interface EndpointResolver {

    /**
     * Optionally rephrases the query, retrieves candidates from the namespace and picks one.
     * The resolution carries no operation if and only if retrieval found nothing.
     *
     * @param namespace            the namespace to search
     * @param query                the query as submitted
     * @param rephrase             whether to rephrase before retrieval
     * @param rephraseInstructions directive for rephrasing, may be {@code null}
     * @param model                model for every reasoning call
     */
    Resolution resolve(String namespace, String query, boolean rephrase, String rephraseInstructions, ModelConfig model);
}
