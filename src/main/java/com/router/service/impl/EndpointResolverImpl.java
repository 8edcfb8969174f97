package com.router.service.impl;

import com.router.exception.NamespaceNotFoundException;
import com.router.model.Candidate;
import com.router.model.ModelConfig;
import com.router.model.OperationDocument;
import com.router.model.Resolution;
import com.router.reasoning.Signatures;
import com.router.reasoning.Signatures.RephraseInput;
import com.router.retrieval.PayloadMapper;
import com.router.service.api.EndpointFilter;
import com.router.service.api.EndpointResolver;
import com.router.service.api.HybridRetriever;
import com.router.service.api.ReasoningFunction;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class EndpointResolverImpl implements EndpointResolver {

    private final ReasoningFunction reasoningFunction;
    private final HybridRetriever retriever;
    private final EndpointFilter filter;
    private final PayloadMapper payloadMapper;

    public EndpointResolverImpl(ReasoningFunction reasoningFunction, HybridRetriever retriever,
                                EndpointFilter filter, PayloadMapper payloadMapper) {
        this.reasoningFunction = reasoningFunction;
        this.retriever = retriever;
        this.filter = filter;
        this.payloadMapper = payloadMapper;
    }

    /**
     * {@inheritDoc}
     * <p>
     * A missing namespace counts as an empty retrieval. When the filter names nothing from the
     * candidate set, the top fused candidate is used instead.
     */
    @Override
    public Resolution resolve(String namespace, String query, boolean rephrase, String rephraseInstructions, ModelConfig model) {
        String effectiveQuery = rephrase ? rephrase(query, rephraseInstructions, model) : query;

        List<Candidate> candidates;
        try {
            candidates = retriever.retrieve(namespace, effectiveQuery);
        } catch (NamespaceNotFoundException e) {
            log.warn("Namespace '{}' does not exist, treating it as having no candidates", namespace);
            candidates = List.of();
        }
        if (candidates.isEmpty()) {
            log.info("No candidate operation in namespace '{}'", namespace);
            return Resolution.none(effectiveQuery);
        }

        List<OperationDocument> documents = candidates.stream()
                .map(c -> payloadMapper.toDocument(c.pointId(), namespace, c.payload()))
                .toList();
        Optional<OperationDocument> chosen = filter.select(effectiveQuery, documents, model);
        OperationDocument operation = chosen.orElseGet(() -> {
            log.info("Filter kept no candidate, falling back to the top fused one");
            return documents.get(0);
        });
        log.info("Resolved operation {} {} in namespace '{}'", operation.method(), operation.url(), namespace);
        return new Resolution(effectiveQuery, operation);
    }

    private String rephrase(String query, String instructions, ModelConfig model) {
        String rephrased = reasoningFunction.invoke(Signatures.REPHRASE, new RephraseInput(instructions, query), model)
                .rephrasedQuery();
        if (rephrased == null || rephrased.isBlank()) {
            return query;
        }
        log.debug("Rephrased query: {}", rephrased);
        return rephrased;
    }
}
