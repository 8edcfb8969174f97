package com.router.service.api;

import com.router.model.ExecutionContext;
import com.router.model.ModelConfig;
import com.router.reasoning.Signatures.NextStepDecision;
import java.util.List;

/**
 * Reasoning steps of planning: decomposition, next-step generation and the final answer.
 */
public interface PlanningService {

    /**
     * Splits a goal into ordered single-namespace steps in one call.
     */
    List<String> decompose(String goal, String workflowInstructions, ModelConfig model);

    /**
     * Decides the next step from the goal and everything executed so far.
     */
    NextStepDecision nextStep(String goal, ExecutionContext context, String workflowInstructions, ModelConfig model);

    /**
     * Answers the goal from the whole context of a session.
     */
    String finalAnswer(String goal, ExecutionContext context, ModelConfig model);

    /**
     * Concatenates the usage guides of the given namespaces.
     *
     * @return the guidance, or {@code null} when no namespace has a guide
     */
    String workflowInstructions(List<String> namespaces);
}
