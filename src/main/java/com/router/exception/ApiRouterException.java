package com.router.exception;

/**
 * Base runtime exception for every failure raised by the routing pipeline.
 * <p>
 * Subclasses name the failure kinds a caller may want to tell apart (missing namespace,
 * missing model credential, unsupported HTTP verb, remote call failure and so on). Lower
 * layers wrap library exceptions into one of them; code that catches an
 * {@code ApiRouterException} should rethrow it untouched rather than wrap it again.
 */
public class ApiRouterException extends RuntimeException {

    /**
     * @param message the detail message
     */
    public ApiRouterException(String message) {
        super(message);
    }

    /**
     * @param message the detail message
     * @param cause   the underlying cause, may be {@code null}
     */
    public ApiRouterException(String message, Throwable cause) {
        super(message, cause);
    }
}
