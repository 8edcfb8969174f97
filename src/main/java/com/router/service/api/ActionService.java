package com.router.service.api;

import com.router.dto.request.ActionRequest;
import com.router.dto.request.IdentifyRequest;
import com.router.dto.response.ActionResult;
import com.router.dto.response.IdentifiedEndpoint;

/**
 * Single-step entry points: identify an operation, or identify and execute it.
 */
public interface ActionService {

    IdentifiedEndpoint identify(IdentifyRequest request);

    /**
     * Resolves and executes one operation. When nothing matches, the result is unresolved and
     * no remote call is made.
     */
    ActionResult act(ActionRequest request);
}
