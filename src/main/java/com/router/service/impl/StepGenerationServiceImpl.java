package com.router.service.impl;

import com.router.dto.request.GenerateStepsRequest;
import com.router.dto.response.GeneratedSteps;
import com.router.dto.response.GeneratedSteps.PlannedStep;
import com.router.model.Integration;
import com.router.service.api.IntegrationDirectory;
import com.router.service.api.IntegrationSelector;
import com.router.service.api.PlanningService;
import com.router.service.api.StepGenerationService;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Static planning: the whole step list is generated up front and each step is assigned to one of
 * the requested integrations. Nothing is executed.
 */
@Service
public class StepGenerationServiceImpl implements StepGenerationService {

    private final PlanningService planningService;
    private final IntegrationSelector integrationSelector;
    private final IntegrationDirectory integrationDirectory;
    private final CredentialResolver credentialResolver;
    private final TemporalContext temporalContext;

    public StepGenerationServiceImpl(PlanningService planningService, IntegrationSelector integrationSelector,
                                     IntegrationDirectory integrationDirectory, CredentialResolver credentialResolver,
                                     TemporalContext temporalContext) {
        this.planningService = planningService;
        this.integrationSelector = integrationSelector;
        this.integrationDirectory = integrationDirectory;
        this.credentialResolver = credentialResolver;
        this.temporalContext = temporalContext;
    }

    /**
     * Generates the steps for a goal.
     *
     * @param request the goal, the namespaces it may use and the model
     * @return the planned steps with their integration ids, plus the integrations considered
     * @throws com.router.exception.MissingCredentialException if no key is configured for the model
     * @throws com.router.exception.SchemaViolationException  if a step is assigned to an unknown integration
     */
    @Override
    public GeneratedSteps generate(GenerateStepsRequest request) {
        credentialResolver.resolve(request.model());
        List<Integration> integrations = integrationDirectory.lookup(request.namespaces());

        List<String> steps = planningService.decompose(temporalContext.stamp(request.goal()),
                planningService.workflowInstructions(request.namespaces()), request.model());

        List<PlannedStep> planned = new ArrayList<>(steps.size());
        for (String step : steps) {
            Integration integration = integrationSelector.select(step, integrations, request.model());
            planned.add(new PlannedStep(step, integration.id()));
        }
        return new GeneratedSteps(planned, integrations, request.goal());
    }
}
