package com.router.service.api;

import com.router.model.ModelConfig;
import com.router.reasoning.Signature;

/**
 * Maps a typed input record to a typed output record by natural-language reasoning.
 * <p>
 * Every language-model use of the pipeline (rephrasing, endpoint filtering, planning,
 * extraction, synthesis) goes through this single seam.
 */
public interface ReasoningFunction {

    /**
     * @param signature the task to perform
     * @param input     the task input
     * @param model     the model to run the task on
     * @return the parsed answer, never {@code null}
     * @throws com.router.exception.MissingCredentialException if no key is configured for the model
     * @throws com.router.exception.ReasoningException         if the call fails or the answer is unreadable
     */
    <I, O> O invoke(Signature<I, O> signature, I input, ModelConfig model);
}
