package com.router.exception;

import lombok.Getter;

/**
 * Raised when no API key is configured for the requested model. Fatal to the session.
 */
@Getter
public class MissingCredentialException extends ApiRouterException {

    private final String model;

    public MissingCredentialException(String model) {
        super("No API key found for LLM: " + model);
        this.model = model;
    }
}
