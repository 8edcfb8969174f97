package com.router.service.api;

import com.router.model.Integration;
import com.router.model.ModelConfig;
import java.util.List;

public interface IntegrationSelector {

    /**
     * Chooses the integration a step belongs to.
     *
     * @return an element of {@code integrations}
     * @throws com.router.exception.SchemaViolationException if the answer names no known integration
     */
    Integration select(String step, List<Integration> integrations, ModelConfig model);
}
