package com.router.service.api;

import com.router.model.Candidate;
import java.util.List;

public interface HybridRetriever {

    /**
     * Searches the three embedding spaces of a namespace and fuses the results.
     *
     * @param namespace the namespace to search
     * @param query     the query text
     * @return at most the configured number of fused candidates, best first, without duplicates
     * @throws com.router.exception.NamespaceNotFoundException if the namespace does not exist
     */
    List<Candidate> retrieve(String namespace, String query);
}
