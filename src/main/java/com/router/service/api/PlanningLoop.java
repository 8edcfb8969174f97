package com.router.service.api;

import com.router.dto.request.DeepRequest;
import com.router.dto.response.ActionResult;
import com.router.model.ExecutionContext;
import com.router.model.Integration;
import com.router.model.Step;
import com.router.model.StepRecord;
import com.router.model.TerminationReason;
import java.util.List;

/**
 * The dynamic planning loop: plan one step, execute it, accumulate its result, repeat.
 */
public interface PlanningLoop {

    /**
     * Runs one session to termination. Failures of any step propagate and abort the session.
     *
     * @param request  the goal and its execution settings
     * @param listener receives progress in order
     * @return the accumulated context and why the loop stopped
     */
    LoopOutcome run(DeepRequest request, LoopListener listener);

    /**
     * Progress callbacks, invoked on the thread running the loop.
     */
    interface LoopListener {

        void onStart(List<Integration> integrations, int maxSteps);

        void onStepStart(int stepNumber, Step step, Integration integration);

        void onStepComplete(StepRecord record, Integration integration, ActionResult result);

        /**
         * Checked before every iteration.
         */
        default boolean isCancelled() {
            return false;
        }
    }

    /**
     * @param goal        the goal as sent to the planner, with its temporal prefix
     * @param context     results of every executed step
     * @param termination why the loop stopped
     */
    record LoopOutcome(String goal, ExecutionContext context, TerminationReason termination) {

        public boolean truncated() {
            return termination == TerminationReason.ITERATION_CAP;
        }
    }
}
