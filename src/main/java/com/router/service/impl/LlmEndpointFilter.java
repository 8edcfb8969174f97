package com.router.service.impl;

import com.router.model.ModelConfig;
import com.router.model.OperationDocument;
import com.router.reasoning.Signatures;
import com.router.reasoning.Signatures.EndpointSummary;
import com.router.reasoning.Signatures.FilterInput;
import com.router.reasoning.Signatures.FilterOutput;
import com.router.service.api.EndpointFilter;
import com.router.service.api.ReasoningFunction;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Asks the model to pick one of the candidates by description, then maps the answer back onto
 * the candidate list by method and url. Answers naming nothing from the list are ignored.
 */
@Service
@Slf4j
public class LlmEndpointFilter implements EndpointFilter {

    private final ReasoningFunction reasoningFunction;

    public LlmEndpointFilter(ReasoningFunction reasoningFunction) {
        this.reasoningFunction = reasoningFunction;
    }

    @Override
    public Optional<OperationDocument> select(String query, List<OperationDocument> candidates, ModelConfig model) {
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        List<EndpointSummary> summaries = candidates.stream()
                .map(doc -> new EndpointSummary(doc.url(), doc.description(), doc.method()))
                .toList();

        FilterOutput output = reasoningFunction.invoke(Signatures.FILTER_ENDPOINTS, new FilterInput(summaries, query), model);
        if (output.filteredEndpoints() == null) {
            return Optional.empty();
        }
        for (EndpointSummary chosen : output.filteredEndpoints()) {
            Optional<OperationDocument> match = candidates.stream()
                    .filter(doc -> matches(doc, chosen))
                    .findFirst();
            if (match.isPresent()) {
                return match;
            }
            log.warn("Filter answered an operation outside the candidate set: {} {}", chosen.method(), chosen.url());
        }
        return Optional.empty();
    }

    private static boolean matches(OperationDocument doc, EndpointSummary chosen) {
        return chosen != null
                && chosen.method() != null
                && doc.method().equalsIgnoreCase(chosen.method().trim())
                && normalize(doc.url()).equals(normalize(chosen.url()));
    }

    private static String normalize(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        return trimmed.length() > 1 && trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
