package com.router.service.impl;

import com.router.dto.request.ActionRequest;
import com.router.dto.request.IdentifyRequest;
import com.router.dto.response.ActionResult;
import com.router.dto.response.IdentifiedEndpoint;
import com.router.model.ExecutionOutcome;
import com.router.model.OperationDocument;
import com.router.model.Resolution;
import com.router.service.api.ActionService;
import com.router.service.api.EndpointResolver;
import com.router.service.api.OperationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs resolver, extractor and executor for one goal. The goal is stamped with the current date
 * before it reaches any reasoning call.
 */
@Service
@Slf4j
public class ActionServiceImpl implements ActionService {

    private final EndpointResolver endpointResolver;
    private final OperationExecutor operationExecutor;
    private final CredentialResolver credentialResolver;
    private final TemporalContext temporalContext;

    public ActionServiceImpl(EndpointResolver endpointResolver, OperationExecutor operationExecutor,
                             CredentialResolver credentialResolver, TemporalContext temporalContext) {
        this.endpointResolver = endpointResolver;
        this.operationExecutor = operationExecutor;
        this.credentialResolver = credentialResolver;
        this.temporalContext = temporalContext;
    }

    @Override
    public IdentifiedEndpoint identify(IdentifyRequest request) {
        credentialResolver.resolve(request.model());
        Resolution resolution = endpointResolver.resolve(request.namespace(), temporalContext.stamp(request.query()),
                request.rephrase(), request.rephraseInstructions(), request.model());
        return resolution.operation()
                .map(op -> new IdentifiedEndpoint(op, OperationCommand.join(request.baseAddress(), op.url()), resolution.rephrasedQuery()))
                .orElseGet(() -> new IdentifiedEndpoint(null, null, resolution.rephrasedQuery()));
    }

    @Override
    public ActionResult act(ActionRequest request) {
        credentialResolver.resolve(request.model());
        ActionRequest stamped = request.toBuilder()
                .goal(temporalContext.stamp(request.goal()))
                .build();

        Resolution resolution = endpointResolver.resolve(stamped.namespace(), stamped.goal(), stamped.rephrase(),
                stamped.rephraseInstructions(), stamped.model());
        if (resolution.operation().isEmpty()) {
            log.info("No operation matched the goal in namespace '{}'", request.namespace());
            return ActionResult.unresolved(resolution.rephrasedQuery());
        }

        OperationDocument operation = resolution.document();
        ExecutionOutcome outcome = operationExecutor.execute(operation, stamped);
        return ActionResult.of(resolution.rephrasedQuery(), operation, outcome);
    }
}
