package com.router.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.router.exception.ApiRouterException;
import com.router.model.FieldDefinition;
import com.router.model.OperationDocument;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Binds an argument map to the request line of one operation.
 * <p>
 * Built from the declared parameter schema of one operation. Values of {@code {name}}
 * placeholders in the path are substituted, header parameters become headers and every other
 * declared parameter becomes a query parameter. Undeclared arguments are dropped.
 */
@Slf4j
public class OperationCommand {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^}/]+)}");

    private final OperationDocument operation;
    private final Set<String> pathNames = new LinkedHashSet<>();
    private final Set<String> headerNames = new LinkedHashSet<>();
    private final Set<String> queryNames = new LinkedHashSet<>();
    private final Set<String> requiredNames = new LinkedHashSet<>();

    public OperationCommand(OperationDocument operation) {
        this.operation = operation;
        Matcher matcher = PLACEHOLDER.matcher(operation.url() == null ? "" : operation.url());
        while (matcher.find()) {
            pathNames.add(matcher.group(1));
        }
        for (FieldDefinition field : operation.parameters().fields()) {
            if (field.required()) {
                requiredNames.add(field.name());
            }
            if (field.isPathParameter() || pathNames.contains(field.name())) {
                pathNames.add(field.name());
            } else if ("header".equalsIgnoreCase(field.location())) {
                headerNames.add(field.name());
            } else {
                queryNames.add(field.name());
            }
        }
    }

    /**
     * @param baseAddress base URL of the integration, trailing slash optional
     * @param arguments   extracted parameters
     * @return the full URI and the header parameters
     * @throws ApiRouterException if a path placeholder has no value
     */
    public BoundCall bind(String baseAddress, ObjectNode arguments) {
        for (String name : requiredNames) {
            if (!arguments.has(name)) {
                log.warn("Required parameter '{}' of {} has no value", name, operation.operationKey());
            }
        }
        arguments.fieldNames().forEachRemaining(name -> {
            if (!pathNames.contains(name) && !headerNames.contains(name) && !queryNames.contains(name)) {
                log.warn("Dropping undeclared parameter '{}' for {}", name, operation.operationKey());
            }
        });

        Map<String, Object> variables = new HashMap<>();
        for (String name : pathNames) {
            JsonNode value = arguments.get(name);
            if (value == null || value.isNull()) {
                throw new ApiRouterException("No value for path parameter '" + name + "' of " + operation.operationKey());
            }
            variables.put(name, text(value));
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(join(baseAddress, operation.url()));
        int index = 0;
        for (String name : queryNames) {
            JsonNode value = arguments.get(name);
            if (value == null || value.isNull()) {
                continue;
            }
            List<JsonNode> values = value.isArray() ? toList(value) : List.of(value);
            for (JsonNode item : values) {
                String variable = "__q" + index++;
                builder.queryParam(name, "{" + variable + "}");
                variables.put(variable, text(item));
            }
        }

        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : headerNames) {
            JsonNode value = arguments.get(name);
            if (value != null && !value.isNull()) {
                headers.put(name, text(value));
            }
        }

        URI uri = builder.encode().buildAndExpand(variables).toUri();
        return new BoundCall(uri, headers);
    }

    public OperationDocument operation() {
        return operation;
    }

    static String join(String baseAddress, String path) {
        String url = path == null ? "" : path;
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }
        String base = baseAddress == null ? "" : baseAddress;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (!url.isEmpty() && !url.startsWith("/")) {
            url = "/" + url;
        }
        return base + url;
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> items = new ArrayList<>();
        array.forEach(items::add);
        return items;
    }

    private static String text(JsonNode value) {
        return value.isValueNode() ? value.asText() : value.toString();
    }

    /**
     * @param uri     the request URI with path and query parameters applied
     * @param headers header parameters taken from the arguments
     */
    public record BoundCall(URI uri, Map<String, String> headers) {
    }
}
