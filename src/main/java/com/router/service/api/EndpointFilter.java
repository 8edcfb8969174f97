package com.router.service.api;

import com.router.model.ModelConfig;
import com.router.model.OperationDocument;
import java.util.List;
import java.util.Optional;

/**
 * Narrows retrieved candidates to the single operation that best serves a query.
 * <p>
 * Any implementation must return an element of {@code candidates} and should prefer a loose
 * match over no answer.
 */
public interface EndpointFilter {

    Optional<OperationDocument> select(String query, List<OperationDocument> candidates, ModelConfig model);
}
