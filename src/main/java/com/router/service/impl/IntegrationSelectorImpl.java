package com.router.service.impl;

import com.router.exception.ApiRouterException;
import com.router.exception.SchemaViolationException;
import com.router.model.Integration;
import com.router.model.ModelConfig;
import com.router.reasoning.Signatures;
import com.router.reasoning.Signatures.IntegrationPickInput;
import com.router.service.api.IntegrationSelector;
import com.router.service.api.ReasoningFunction;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Picks the integration of a step with a reasoning call and checks the answer against the known
 * set: exact id first, then id or display name ignoring case.
 */
@Service
@Slf4j
public class IntegrationSelectorImpl implements IntegrationSelector {

    private final ReasoningFunction reasoningFunction;

    public IntegrationSelectorImpl(ReasoningFunction reasoningFunction) {
        this.reasoningFunction = reasoningFunction;
    }

    @Override
    public Integration select(String step, List<Integration> integrations, ModelConfig model) {
        if (integrations.isEmpty()) {
            throw new ApiRouterException("No integrations to choose from for step: " + step);
        }
        String answer = reasoningFunction.invoke(Signatures.PICK_INTEGRATION, new IntegrationPickInput(step, integrations), model)
                .integrationId();
        String id = answer == null ? "" : answer.trim();

        Optional<Integration> match = integrations.stream()
                .filter(i -> i.id().equals(id))
                .findFirst()
                .or(() -> integrations.stream()
                        .filter(i -> i.id().equalsIgnoreCase(id) || (i.name() != null && i.name().equalsIgnoreCase(id)))
                        .findFirst());

        Integration integration = match.orElseThrow(() -> new SchemaViolationException(
                "Integration '" + answer + "' chosen for step '" + step + "' is not one of "
                        + integrations.stream().map(Integration::id).toList()));
        log.info("Step '{}' assigned to integration '{}'", step, integration.id());
        return integration;
    }
}
