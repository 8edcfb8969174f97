package com.router.service.api;

import com.router.dto.request.ActionRequest;
import com.router.model.ExecutionOutcome;
import com.router.model.OperationDocument;

public interface OperationExecutor {

    /**
     * Extracts arguments for the operation, calls it and measures the call.
     *
     * @param operation the resolved operation
     * @param request   goal, base address, headers, context and model of the step
     * @return arguments, raw response, latencies and, if requested, a prose summary
     * @throws com.router.exception.UnsupportedMethodException if the operation's verb cannot be dispatched
     * @throws com.router.exception.RemoteCallFailureException if the call fails
     */
    ExecutionOutcome execute(OperationDocument operation, ActionRequest request);
}
