package com.router.exception;

/**
 * Raised when a call to the language model fails or returns output that cannot be read as
 * the expected record.
 */
public class ReasoningException extends ApiRouterException {

    public ReasoningException(String message) {
        super(message);
    }

    public ReasoningException(String message, Throwable cause) {
        super(message, cause);
    }
}
