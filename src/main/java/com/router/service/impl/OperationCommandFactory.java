package com.router.service.impl;

import com.router.model.OperationDocument;
import org.springframework.stereotype.Component;

/**
 * Builds a fresh {@link OperationCommand} for every call, so an edited operation payload takes
 * effect on the next request and nothing outlives the session.
 */
@Component
public class OperationCommandFactory {

    public OperationCommand commandFor(OperationDocument operation) {
        return new OperationCommand(operation);
    }
}
