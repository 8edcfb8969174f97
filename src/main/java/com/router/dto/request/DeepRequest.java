package com.router.dto.request;

import com.router.model.ModelConfig;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * A multi-step goal, executed by the dynamic planning loop and reported as an event stream.
 *
 * @param namespaces              namespaces the planner may use
 * @param baseAddressByNamespace  base URL per namespace
 * @param goal                    the natural-language goal
 * @param headersByNamespace      caller headers per namespace
 * @param model                   the language model used for every reasoning call
 * @param rephrase                whether each step is rephrased before retrieval
 * @param rephraseInstructions    directive for rephrasing, may be {@code null}
 * @param naturalLanguageResponse whether each step is summarized in prose
 */
@Builder
public record DeepRequest(
        List<String> namespaces,
        Map<String, String> baseAddressByNamespace,
        String goal,
        Map<String, Map<String, Object>> headersByNamespace,
        ModelConfig model,
        boolean rephrase,
        String rephraseInstructions,
        boolean naturalLanguageResponse) {

    public DeepRequest {
        namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
        baseAddressByNamespace = baseAddressByNamespace == null ? Map.of() : baseAddressByNamespace;
        headersByNamespace = headersByNamespace == null ? Map.of() : headersByNamespace;
    }

    public String baseAddressOf(String namespace) {
        return baseAddressByNamespace.getOrDefault(namespace, "");
    }

    public Map<String, Object> headersOf(String namespace) {
        return headersByNamespace.getOrDefault(namespace, Map.of());
    }
}
