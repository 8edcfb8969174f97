package com.router.exception;

import lombok.Getter;

/**
 * Raised when a resolved operation declares an HTTP verb the executor cannot dispatch.
 */
@Getter
public class UnsupportedMethodException extends ApiRouterException {

    private final String method;

    public UnsupportedMethodException(String method) {
        super("Unsupported HTTP method: " + method);
        this.method = method;
    }
}
