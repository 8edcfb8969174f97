package com.router.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.router.dto.request.ActionRequest;
import com.router.exception.RemoteCallFailureException;
import com.router.exception.UnsupportedMethodException;
import com.router.model.ExecutionContext;
import com.router.model.ExecutionOutcome;
import com.router.model.OperationDocument;
import com.router.model.SchemaType;
import com.router.reasoning.Signatures;
import com.router.reasoning.Signatures.SynthesisInput;
import com.router.service.api.OperationExecutor;
import com.router.service.api.ReasoningFunction;
import com.router.service.api.SchemaExtractor;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@Service
@Slf4j
public class OperationExecutorImpl implements OperationExecutor {

    private final WebClient webClient;
    private final SchemaExtractor schemaExtractor;
    private final ReasoningFunction reasoningFunction;
    private final OperationCommandFactory commandFactory;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OperationExecutorImpl(WebClient webClient, SchemaExtractor schemaExtractor,
                                 ReasoningFunction reasoningFunction, OperationCommandFactory commandFactory) {
        this.webClient = webClient;
        this.schemaExtractor = schemaExtractor;
        this.reasoningFunction = reasoningFunction;
        this.commandFactory = commandFactory;
    }

    /**
     * Extracts the arguments of an operation from the goal, calls it and returns the response
     * unmodified.
     * <p>
     * The goal is enriched with the session context and the usage guide before extraction. Path,
     * header and query parameters are bound by {@link OperationCommand}; the body is sent as JSON
     * unless the caller's {@code Content-Type} asks for a form.
     *
     * @param operation the resolved operation
     * @param request   the goal, caller headers, base address and model
     * @return the raw response with latencies, plus prose when requested
     * @throws com.router.exception.UnsupportedMethodException if the method cannot be dispatched
     * @throws com.router.exception.RemoteCallFailureException if the call fails or answers non-2xx
     */
    @Override
    public ExecutionOutcome execute(OperationDocument operation, ActionRequest request) {
        long start = System.nanoTime();
        HttpMethod method = httpMethod(operation.method());

        String query = enrich(request.goal(), request.context(), request.usageGuide());
        ObjectNode parameters = schemaExtractor.extract(operation.parameters(), query, SchemaType.PARAMETERS, request.model());
        ObjectNode body = schemaExtractor.extract(operation.body(), query, SchemaType.BODY, request.model());

        OperationCommand.BoundCall call = commandFactory.commandFor(operation).bind(request.baseAddress(), parameters);
        Map<String, String> headers = normalizeHeaders(request.headers());
        headers.putAll(call.headers());

        log.info("Calling {} {}", method.name(), call.uri());
        long apiStart = System.nanoTime();
        JsonNode response = send(method, call, headers, body);
        long apiLatencyMs = millisSince(apiStart);
        long orchestrationLatencyMs = millisSince(start) - apiLatencyMs;
        log.info("{} {} answered in {} ms (orchestration {} ms)", method.name(), operation.url(), apiLatencyMs, orchestrationLatencyMs);

        String prose = null;
        if (request.naturalLanguageResponse()) {
            prose = reasoningFunction.invoke(Signatures.SYNTHESIZE,
                    new SynthesisInput(request.goal(), operation.response(), response), request.model())
                    .naturalLanguageResponse();
        }
        return new ExecutionOutcome(parameters, body, response, apiLatencyMs, orchestrationLatencyMs, prose);
    }

    /**
     * The goal, followed by the results of previous steps and the namespace's usage guide when present.
     */
    static String enrich(String goal, ExecutionContext context, String usageGuide) {
        StringBuilder sb = new StringBuilder(goal);
        if (context != null && !context.isEmpty()) {
            sb.append("\n\n").append(context.describeForExtraction());
        }
        if (usageGuide != null && !usageGuide.isBlank()) {
            sb.append("\n\nIntegration Manual:\n").append(usageGuide);
        }
        return sb.toString();
    }

    /**
     * Header values must be text: maps and collections are sent as JSON, everything else via {@code toString}.
     */
    Map<String, String> normalizeHeaders(Map<String, Object> headers) {
        Map<String, String> normalized = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (value instanceof Map<?, ?> || value instanceof Collection<?> || value instanceof JsonNode node && node.isContainerNode()) {
                try {
                    normalized.put(name, objectMapper.writeValueAsString(value));
                } catch (JsonProcessingException e) {
                    throw new IllegalArgumentException("Header '" + name + "' cannot be serialized", e);
                }
            } else if (value instanceof JsonNode scalar) {
                normalized.put(name, scalar.asText());
            } else {
                normalized.put(name, String.valueOf(value));
            }
        });
        return normalized;
    }

    private static HttpMethod httpMethod(String method) {
        return switch (method) {
            case "GET" -> HttpMethod.GET;
            case "POST" -> HttpMethod.POST;
            case "PUT" -> HttpMethod.PUT;
            case "DELETE" -> HttpMethod.DELETE;
            case "HEAD" -> HttpMethod.HEAD;
            default -> throw new UnsupportedMethodException(method);
        };
    }

    private JsonNode send(HttpMethod method, OperationCommand.BoundCall call, Map<String, String> headers, ObjectNode body) {
        WebClient.RequestBodySpec spec = webClient.method(method).uri(call.uri());
        headers.forEach(spec::header);

        if (method == HttpMethod.POST || method == HttpMethod.PUT) {
            if (isFormEncoded(headers)) {
                spec.body(BodyInserters.fromFormData(formData(body)));
            } else {
                if (!hasHeader(headers, HttpHeaders.CONTENT_TYPE)) {
                    spec.contentType(MediaType.APPLICATION_JSON);
                }
                spec.bodyValue(body);
            }
        }

        try {
            ResponseEntity<String> entity = spec.retrieve().toEntity(String.class).block();
            return parse(entity == null ? null : entity.getBody());
        } catch (WebClientResponseException e) {
            log.error("Remote call {} {} failed with status {} and body: {}", method.name(), call.uri(), e.getStatusCode(), e.getResponseBodyAsString());
            throw new RemoteCallFailureException("Remote call " + method.name() + " " + call.uri() + " failed: " + e.getStatusCode(),
                    e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (WebClientRequestException e) {
            log.error("Remote call {} {} could not be sent", method.name(), call.uri(), e);
            throw new RemoteCallFailureException("Remote call " + method.name() + " " + call.uri() + " could not be sent: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(body);
        }
    }

    private static boolean isFormEncoded(Map<String, String> headers) {
        return headers.entrySet().stream()
                .anyMatch(h -> HttpHeaders.CONTENT_TYPE.equalsIgnoreCase(h.getKey())
                        && h.getValue().toLowerCase(Locale.ROOT).contains("x-www-form-urlencoded"));
    }

    private static boolean hasHeader(Map<String, String> headers, String name) {
        return headers.keySet().stream().anyMatch(name::equalsIgnoreCase);
    }

    private static MultiValueMap<String, String> formData(ObjectNode body) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        body.properties().forEach(field -> {
            JsonNode value = field.getValue();
            if (value.isArray()) {
                value.forEach(item -> form.add(field.getKey(), item.isValueNode() ? item.asText() : item.toString()));
            } else {
                form.add(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
        });
        return form;
    }

    private static long millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
