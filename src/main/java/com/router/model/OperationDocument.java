package com.router.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Locale;

/**
 * A remote API operation as stored in a namespace of the document store.
 * <p>
 * Within a namespace an operation is identified by {@code method + url}; {@link #id()} adds the
 * namespace to make it unique across the catalog. {@code pointId} is the identifier the
 * document store assigned when the operation was inserted.
 *
 * @param pointId     document-store identifier
 * @param namespace   the integration namespace the operation belongs to
 * @param url         path of the operation relative to the integration's base address
 * @param method      HTTP verb, upper case
 * @param description what the operation does
 * @param parameters  declared request parameters
 * @param body        declared request body fields
 * @param response    declared response shape, passed verbatim to synthesis
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OperationDocument(
        String pointId,
        String namespace,
        String url,
        String method,
        String description,
        FieldSchema parameters,
        FieldSchema body,
        JsonNode response) {

    public OperationDocument {
        method = method == null ? "" : method.toUpperCase(Locale.ROOT);
        parameters = parameters == null ? FieldSchema.empty() : parameters;
        body = body == null ? FieldSchema.empty() : body;
    }

    /**
     * @return {@code namespace:METHOD url}
     */
    @JsonIgnore
    public String id() {
        return namespace + ":" + operationKey();
    }

    /**
     * @return {@code METHOD url}, unique within a namespace
     */
    @JsonIgnore
    public String operationKey() {
        return method + " " + url;
    }
}
