package com.router.service.api;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.router.model.FieldSchema;
import com.router.model.ModelConfig;
import com.router.model.SchemaType;

public interface SchemaExtractor {

    /**
     * Extracts an object conforming to {@code schema} from free text.
     * <p>
     * The top-level keys of the result are always a subset of the schema's declared names. An
     * empty schema yields an empty object without any reasoning call.
     *
     * @param schema the fields the caller accepts
     * @param query  the goal, enriched with prior results and usage guidance
     * @param type   whether the schema describes parameters or a body
     * @param model  model for the extraction call
     */
    ObjectNode extract(FieldSchema schema, String query, SchemaType type, ModelConfig model);
}
