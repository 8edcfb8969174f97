package com.router.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.router.model.FieldSchema;
import com.router.model.OperationDocument;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads stored point payloads as {@link OperationDocument}s.
 * <p>
 * The schema fields ({@code parameters}, {@code body}, {@code response}) are accepted either as
 * structured JSON or as JSON text, which is how catalog loaders usually store them.
 */
@Component
@Slf4j
public class PayloadMapper {

    /**
     * Payload key under which the embedded source text is stored; never part of the metadata.
     */
    public static final String TEXT_KEY = "text";

    private final ObjectMapper objectMapper = new ObjectMapper();

    public OperationDocument toDocument(String pointId, String namespace, Map<String, Object> payload) {
        return new OperationDocument(
                pointId,
                namespace,
                string(payload.get("url")),
                string(payload.get("method")),
                string(payload.get("description")),
                FieldSchema.parse(json(payload.get("parameters"))),
                FieldSchema.parse(json(payload.get("body"))),
                json(payload.get("response")));
    }

    /**
     * @return the payload without the reserved {@value #TEXT_KEY} entry
     */
    public static Map<String, Object> metadataOf(Map<String, Object> payload) {
        Map<String, Object> metadata = new LinkedHashMap<>(payload);
        metadata.remove(TEXT_KEY);
        return metadata;
    }

    private JsonNode json(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof String text) {
            if (text.isBlank()) {
                return NullNode.getInstance();
            }
            try {
                return objectMapper.readTree(text);
            } catch (JsonProcessingException e) {
                log.debug("Payload value is not JSON text, keeping it as a string: {}", text);
                return TextNode.valueOf(text);
            }
        }
        return objectMapper.valueToTree(value);
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }
}
