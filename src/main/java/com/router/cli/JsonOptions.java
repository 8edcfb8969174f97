package com.router.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.router.exception.ApiRouterException;
import com.router.model.ExecutionContext;
import com.router.model.ModelConfig;
import java.util.Iterator;
import java.util.Map;

/**
 * Parses the JSON-valued options of the shell commands.
 */
final class JsonOptions {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonOptions() {
    }

    static <T> T parse(String json, TypeReference<T> type, T whenAbsent, String option) {
        if (json == null || json.isBlank()) {
            return whenAbsent;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ApiRouterException("Option " + option + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static Map<String, Object> object(String json, String option) {
        return parse(json, new TypeReference<Map<String, Object>>() {
        }, Map.of(), option);
    }

    /**
     * Reads earlier results as a JSON object of {@code step -> result}, recorded against the
     * given namespace in declaration order.
     *
     * @return the context, or {@code null} when the option is absent
     */
    static ExecutionContext context(String json, String namespace, String option) {
        JsonNode node = parse(json, new TypeReference<JsonNode>() {
        }, null, option);
        if (node == null) {
            return null;
        }
        if (!node.isObject()) {
            throw new ApiRouterException("Option " + option + " must be a JSON object of step to result");
        }
        ExecutionContext context = new ExecutionContext();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            context.append(entry.getKey(), namespace, entry.getValue(), null, false);
        }
        return context;
    }

    static ModelConfig model(String model, String defaultModel) {
        return new ModelConfig(model == null || model.isBlank() ? defaultModel : model);
    }
}
