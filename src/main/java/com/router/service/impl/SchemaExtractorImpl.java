package com.router.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.router.model.FieldDefinition;
import com.router.model.FieldSchema;
import com.router.model.ModelConfig;
import com.router.model.SchemaType;
import com.router.reasoning.Signatures;
import com.router.reasoning.Signatures.ExtractionInput;
import com.router.service.api.ReasoningFunction;
import com.router.service.api.SchemaExtractor;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Extracts structured data with a reasoning call and enforces the schema's top level on the
 * answer: undeclared keys are removed, and optional fields that came back {@code null} are
 * omitted. Nested objects and arrays are passed through as extracted.
 */
@Service
@Slf4j
public class SchemaExtractorImpl implements SchemaExtractor {

    private final ReasoningFunction reasoningFunction;

    public SchemaExtractorImpl(ReasoningFunction reasoningFunction) {
        this.reasoningFunction = reasoningFunction;
    }

    @Override
    public ObjectNode extract(FieldSchema schema, String query, SchemaType type, ModelConfig model) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        if (schema == null || schema.isEmpty()) {
            return result;
        }

        JsonNode extracted = reasoningFunction.invoke(Signatures.EXTRACT, new ExtractionInput(query, schema, type.jsonName()), model)
                .extractedData();
        if (extracted == null || extracted.isNull()) {
            return result;
        }
        if (!extracted.isObject()) {
            log.warn("Extraction of {} returned a {} instead of an object, ignoring it", type.jsonName(), extracted.getNodeType());
            return result;
        }

        Set<String> declared = schema.declaredNames();
        List<String> extra = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = extracted.properties().iterator();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            if (!declared.contains(name)) {
                extra.add(name);
                continue;
            }
            if (field.getValue().isNull() && !isRequired(schema.find(name))) {
                continue;
            }
            result.set(name, field.getValue());
        }
        if (!extra.isEmpty()) {
            log.warn("Extra fields detected and removed from {} data: {}", type.jsonName(), extra);
        }
        log.debug("Extracted {} data: {}", type.jsonName(), result);
        return result;
    }

    private static boolean isRequired(Optional<FieldDefinition> definition) {
        return definition.map(FieldDefinition::required).orElse(false);
    }
}
