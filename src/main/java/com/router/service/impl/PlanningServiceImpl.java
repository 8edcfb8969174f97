package com.router.service.impl;

import com.router.model.ExecutionContext;
import com.router.model.ModelConfig;
import com.router.reasoning.Signatures;
import com.router.reasoning.Signatures.AnswerInput;
import com.router.reasoning.Signatures.DecomposeInput;
import com.router.reasoning.Signatures.NextStepDecision;
import com.router.reasoning.Signatures.NextStepInput;
import com.router.service.api.PlanningService;
import com.router.service.api.ReasoningFunction;
import com.router.service.api.UsageGuideRepository;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Planning questions put to the language model: static decomposition of a goal, the next step
 * of a running session and the closing answer. Usage guides of the involved namespaces are
 * attached as workflow instructions.
 */
@Service
@Slf4j
public class PlanningServiceImpl implements PlanningService {

    private final ReasoningFunction reasoningFunction;
    private final UsageGuideRepository guides;

    public PlanningServiceImpl(ReasoningFunction reasoningFunction, UsageGuideRepository guides) {
        this.reasoningFunction = reasoningFunction;
        this.guides = guides;
    }

    /**
     * Splits a goal into ordered, self-contained steps.
     *
     * @param goal                 the time-stamped goal
     * @param workflowInstructions rendered usage guides, may be {@code null}
     * @param model                the model to plan with
     * @return the non-blank steps, trimmed; empty when the model returns none
     */
    @Override
    public List<String> decompose(String goal, String workflowInstructions, ModelConfig model) {
        List<String> steps = reasoningFunction.invoke(Signatures.DECOMPOSE, new DecomposeInput(goal, workflowInstructions), model)
                .steps();
        if (steps == null) {
            return List.of();
        }
        List<String> cleaned = steps.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(String::trim)
                .toList();
        log.info("Decomposed goal into {} steps", cleaned.size());
        return cleaned;
    }

    /**
     * Asks for the single next step given what the session has executed so far.
     *
     * @param goal                 the time-stamped goal
     * @param context              the steps executed so far
     * @param workflowInstructions rendered usage guides, may be {@code null}
     * @param model                the model to plan with
     * @return the decision; {@code nextStep} may be {@code null} when nothing is left to do
     */
    @Override
    public NextStepDecision nextStep(String goal, ExecutionContext context, String workflowInstructions, ModelConfig model) {
        NextStepDecision decision = reasoningFunction.invoke(Signatures.NEXT_STEP,
                new NextStepInput(goal, context.describeForPlanning(), workflowInstructions), model);
        log.debug("Next step after {} executed: {} (complete: {})", context.size(), decision.nextStep(), decision.complete());
        return decision;
    }

    @Override
    public String finalAnswer(String goal, ExecutionContext context, ModelConfig model) {
        return reasoningFunction.invoke(Signatures.FINAL_ANSWER, new AnswerInput(goal, context.describeForAnswer()), model)
                .response();
    }

    /**
     * Concatenates the usage guides of the given namespaces. Namespaces without a guide are skipped.
     *
     * @return the rendered guides, or {@code null} when none exists
     */
    @Override
    public String workflowInstructions(List<String> namespaces) {
        StringBuilder sb = new StringBuilder();
        for (String namespace : namespaces) {
            String guide = guides.load(namespace);
            if (!guide.isBlank()) {
                sb.append("\nIntegration ").append(namespace).append(" manual:\n").append(guide).append('\n');
            }
        }
        return sb.length() == 0 ? null : sb.toString();
    }
}
