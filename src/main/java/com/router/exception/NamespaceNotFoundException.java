package com.router.exception;

import lombok.Getter;

/**
 * Raised by retrieval when the requested namespace has no collection in the vector store.
 * The endpoint resolver treats it as "no candidates".
 */
@Getter
public class NamespaceNotFoundException extends ApiRouterException {

    private final String namespace;

    public NamespaceNotFoundException(String namespace) {
        super("Namespace '" + namespace + "' does not exist in the document store.");
        this.namespace = namespace;
    }
}
