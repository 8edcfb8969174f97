package com.router.dto.request;

import com.router.model.ExecutionContext;
import com.router.model.ModelConfig;
import java.util.Map;
import lombok.Builder;

/**
 * A single-step goal: resolve one operation in one namespace and execute it.
 *
 * @param namespace               the namespace to search
 * @param baseAddress             base URL the operation path is appended to
 * @param goal                    the natural-language goal
 * @param rephrase                whether to rephrase the goal before retrieval
 * @param rephraseInstructions    directive for rephrasing, may be {@code null}
 * @param headers                 caller-supplied headers; non-string values are sent as JSON text
 * @param model                   the language model used for every reasoning call
 * @param context                 results of earlier steps of the same session, may be {@code null}
 * @param usageGuide              usage guide of the namespace, may be empty
 * @param naturalLanguageResponse whether to synthesize prose from the response
 */
@Builder(toBuilder = true)
public record ActionRequest(
        String namespace,
        String baseAddress,
        String goal,
        boolean rephrase,
        String rephraseInstructions,
        Map<String, Object> headers,
        ModelConfig model,
        ExecutionContext context,
        String usageGuide,
        boolean naturalLanguageResponse) {

    public ActionRequest {
        headers = headers == null ? Map.of() : headers;
        baseAddress = baseAddress == null ? "" : baseAddress;
    }
}
