package com.router.exception;

import lombok.Getter;

/**
 * Raised when the remote operation call fails, either at the transport level or with a
 * non-successful HTTP status. Never caught inside the pipeline: it aborts the session.
 */
@Getter
public class RemoteCallFailureException extends ApiRouterException {

    /**
     * HTTP status of the failed response, or {@code -1} for transport failures.
     */
    private final int status;

    private final String responseBody;

    public RemoteCallFailureException(String message, int status, String responseBody, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.responseBody = responseBody;
    }

    public RemoteCallFailureException(String message, Throwable cause) {
        this(message, -1, null, cause);
    }
}
