package com.router.exception;

/**
 * Raised when a reasoning call answers outside its declared contract and the answer cannot
 * be repaired locally, for example an integration identifier that is not part of the known set.
 */
public class SchemaViolationException extends ApiRouterException {

    public SchemaViolationException(String message) {
        super(message);
    }
}
