package com.router.model;

/**
 * Selects the language model used for every reasoning call of one request.
 * <p>
 * The value is passed explicitly through retrieval filtering, planning, extraction and
 * synthesis, so concurrent sessions configured with different models never share state.
 *
 * @param llm the model identifier, optionally prefixed with a provider (e.g. {@code openai/gpt-4.1})
 */
public record ModelConfig(String llm) {

    /**
     * @return the model name without its provider prefix, as sent to the chat-completions API
     */
    public String modelName() {
        int slash = llm.indexOf('/');
        return slash >= 0 ? llm.substring(slash + 1) : llm;
    }
}
