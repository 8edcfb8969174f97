package com.router.service.api;

import com.router.model.OperationDocument;
import java.util.List;
import java.util.Map;

/**
 * Per-namespace catalog of operation documents.
 */
public interface DocumentStore {

    /**
     * Embeds {@code text} into all three spaces and stores {@code metadata} as the payload. The
     * namespace's vector configuration is created on first insert.
     *
     * @return the identifier of the new document
     */
    String insert(String namespace, String text, Map<String, Object> metadata);

    /**
     * Replaces the metadata of a document. Last write wins.
     */
    void editPayload(String namespace, String id, Map<String, Object> metadata);

    /**
     * @throws com.router.exception.NamespaceNotFoundException if the namespace does not exist
     */
    List<OperationDocument> list(String namespace);
}
