package com.router.service.impl;

import com.router.config.RouterProperties;
import com.router.dto.request.ActionRequest;
import com.router.dto.request.DeepRequest;
import com.router.dto.response.ActionResult;
import com.router.model.ExecutionContext;
import com.router.model.Integration;
import com.router.model.ModelConfig;
import com.router.model.Step;
import com.router.model.StepRecord;
import com.router.model.TerminationReason;
import com.router.reasoning.Signatures.NextStepDecision;
import com.router.service.api.ActionService;
import com.router.service.api.IntegrationDirectory;
import com.router.service.api.IntegrationSelector;
import com.router.service.api.PlanningLoop;
import com.router.service.api.PlanningService;
import com.router.service.api.UsageGuideRepository;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Dynamic planning with a hard iteration cap of 7 steps ({@code router.max-steps} may only lower it).
 * <p>
 * Each iteration asks for the next step, assigns it to an integration, executes it through the
 * single-step pipeline and appends the raw result to the session context. The loop ends when
 * the generator reports completion, returns no step, or the cap is reached. A step returned
 * together with {@code is_complete = true} is executed as the last one.
 */
@Service
@Slf4j
public class BoundedPlanningLoop implements PlanningLoop {

    private final PlanningService planningService;
    private final IntegrationSelector integrationSelector;
    private final IntegrationDirectory integrationDirectory;
    private final ActionService actionService;
    private final UsageGuideRepository guides;
    private final CredentialResolver credentialResolver;
    private final TemporalContext temporalContext;
    private final RouterProperties properties;

    public BoundedPlanningLoop(PlanningService planningService, IntegrationSelector integrationSelector,
                               IntegrationDirectory integrationDirectory, ActionService actionService,
                               UsageGuideRepository guides, CredentialResolver credentialResolver,
                               TemporalContext temporalContext, RouterProperties properties) {
        this.planningService = planningService;
        this.integrationSelector = integrationSelector;
        this.integrationDirectory = integrationDirectory;
        this.actionService = actionService;
        this.guides = guides;
        this.credentialResolver = credentialResolver;
        this.temporalContext = temporalContext;
        this.properties = properties;
    }

    @Override
    public LoopOutcome run(DeepRequest request, LoopListener listener) {
        ModelConfig model = request.model();
        credentialResolver.resolve(model);

        int maxSteps = properties.effectiveMaxSteps();
        List<Integration> integrations = integrationDirectory.lookup(request.namespaces());
        listener.onStart(integrations, maxSteps);

        String goal = temporalContext.stamp(request.goal());
        String workflowInstructions = planningService.workflowInstructions(request.namespaces());
        ExecutionContext context = new ExecutionContext();
        TerminationReason termination = TerminationReason.ITERATION_CAP;

        for (int stepNumber = 1; stepNumber <= maxSteps; stepNumber++) {
            if (listener.isCancelled()) {
                termination = TerminationReason.CANCELLED;
                break;
            }
            NextStepDecision decision = planningService.nextStep(goal, context, workflowInstructions, model);
            if (!decision.hasNextStep()) {
                termination = decision.complete() ? TerminationReason.GOAL_SATISFIED : TerminationReason.NO_NEXT_STEP;
                break;
            }

            String text = decision.nextStep().trim();
            Integration integration = integrationSelector.select(text, integrations, model);
            Step step = new Step(text, integration.id(), decision.reasoning());
            listener.onStepStart(stepNumber, step, integration);
            log.info("Step {}: {} [{}]", stepNumber, text, integration.name());

            String guide = guides.load(integration.id());
            ActionResult result = actionService.act(ActionRequest.builder()
                    .namespace(integration.id())
                    .baseAddress(request.baseAddressOf(integration.id()))
                    .goal(step.text())
                    .rephrase(request.rephrase())
                    .rephraseInstructions(request.rephraseInstructions())
                    .headers(request.headersOf(integration.id()))
                    .model(model)
                    .context(context)
                    .usageGuide(guide)
                    .naturalLanguageResponse(request.naturalLanguageResponse())
                    .build());

            StepRecord record = context.append(step.text(), step.namespace(), result.response(), step.reasoning(), !guide.isBlank());
            listener.onStepComplete(record, integration, result);

            if (decision.complete()) {
                termination = TerminationReason.GOAL_SATISFIED;
                break;
            }
        }

        if (termination == TerminationReason.ITERATION_CAP) {
            log.warn("Planning stopped at the iteration cap of {} steps; the goal may be unfinished", maxSteps);
        } else {
            log.info("Planning finished after {} steps: {}", context.size(), termination);
        }
        return new LoopOutcome(goal, context, termination);
    }
}
