package com.router.retrieval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.router.config.QdrantProperties;
import com.router.exception.ApiRouterException;
import com.router.exception.NamespaceNotFoundException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Thin client for the Qdrant REST API. Every namespace is one collection holding three named
 * vector spaces: a dense space, a sparse BM25 space and a multi-vector late-interaction space.
 */
@Component
@Slf4j
public class QdrantRestClient {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };
    private static final int SCROLL_PAGE = 256;
    private static final ObjectMapper JSON = new ObjectMapper();

    private final WebClient webClient;
    private final QdrantProperties properties;

    public QdrantRestClient(WebClient webClient, QdrantProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    public boolean collectionExists(String collection) {
        JsonNode response = call(HttpMethod.GET, "/collections/{c}/exists", null, collection);
        return response.path("result").path("exists").asBoolean(false);
    }

    /**
     * Creates the collection with its three vector spaces. The configuration is never changed afterwards.
     */
    public void createCollection(String collection, int denseSize, int lateSize,
                                 String denseName, String sparseName, String lateName) {
        ObjectNode body = JSON.createObjectNode();
        ObjectNode vectors = body.putObject("vectors");
        vectors.putObject(denseName)
                .put("size", denseSize)
                .put("distance", "Cosine");
        vectors.putObject(lateName)
                .put("size", lateSize)
                .put("distance", "Cosine")
                .putObject("multivector_config").put("comparator", "max_sim");
        body.putObject("sparse_vectors").putObject(sparseName).put("modifier", "idf");

        call(HttpMethod.PUT, "/collections/{c}", body, collection);
        log.info("Created collection '{}' (dense {}d, late {}d, sparse idf)", collection, denseSize, lateSize);
    }

    public void upsertPoint(String collection, String pointId, Map<String, JsonNode> vectors, Map<String, Object> payload) {
        ObjectNode body = JSON.createObjectNode();
        ObjectNode point = body.putArray("points").addObject();
        point.put("id", pointId);
        ObjectNode vectorNode = point.putObject("vector");
        vectors.forEach(vectorNode::set);
        point.set("payload", JSON.valueToTree(payload));

        call(HttpMethod.PUT, "/collections/{c}/points?wait=true", body, collection);
    }

    /**
     * Nearest-neighbour search in one named space.
     *
     * @throws NamespaceNotFoundException if the collection does not exist
     */
    public List<RankedPoint> query(String collection, String using, JsonNode query, int limit) {
        ObjectNode body = JSON.createObjectNode();
        body.set("query", query);
        body.put("using", using);
        body.put("limit", limit);
        body.put("with_payload", true);

        JsonNode response = call(HttpMethod.POST, "/collections/{c}/points/query", body, collection);
        return toPoints(response.path("result").path("points"));
    }

    /**
     * Replaces the whole payload of one point.
     */
    public void overwritePayload(String collection, String pointId, Map<String, Object> payload) {
        ObjectNode body = JSON.createObjectNode();
        body.set("payload", JSON.valueToTree(payload));
        body.putArray("points").add(pointId);

        call(HttpMethod.PUT, "/collections/{c}/points/payload?wait=true", body, collection);
    }

    /**
     * @return every point of the collection with its payload, in store order
     */
    public List<RankedPoint> scroll(String collection) {
        List<RankedPoint> points = new ArrayList<>();
        JsonNode offset = null;
        do {
            ObjectNode body = JSON.createObjectNode();
            body.put("limit", SCROLL_PAGE);
            body.put("with_payload", true);
            body.put("with_vector", false);
            if (offset != null) {
                body.set("offset", offset);
            }
            JsonNode result = call(HttpMethod.POST, "/collections/{c}/points/scroll", body, collection).path("result");
            points.addAll(toPoints(result.path("points")));
            offset = result.path("next_page_offset");
        } while (offset != null && !offset.isNull() && !offset.isMissingNode());
        return points;
    }

    private List<RankedPoint> toPoints(JsonNode array) {
        List<RankedPoint> points = new ArrayList<>();
        for (JsonNode hit : array) {
            Map<String, Object> payload = hit.hasNonNull("payload")
                    ? JSON.convertValue(hit.get("payload"), PAYLOAD_TYPE)
                    : Map.of();
            points.add(new RankedPoint(hit.path("id").asText(), hit.path("score").asDouble(0), payload));
        }
        return points;
    }

    private JsonNode call(HttpMethod method, String path, JsonNode body, String collection) {
        WebClient.RequestBodySpec spec = webClient.method(method)
                .uri(properties.getUrl() + path, collection);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            spec.header("api-key", properties.getApiKey());
        }
        if (body != null) {
            spec.bodyValue(body);
        }
        try {
            JsonNode response = spec.retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofMillis(properties.getTimeoutMs()));
            return response == null ? JSON.createObjectNode() : response;
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw new NamespaceNotFoundException(collection);
            }
            log.error("Vector store call {} {} failed with status {}: {}", method, path, e.getStatusCode(),
                    e.getResponseBodyAsString());
            throw new ApiRouterException("Vector store call failed for collection '" + collection + "': "
                    + e.getStatusCode(), e);
        } catch (WebClientRequestException e) {
            throw new ApiRouterException("Vector store is unreachable at " + properties.getUrl(), e);
        } catch (IllegalStateException e) {
            throw new ApiRouterException("Vector store call timed out after " + properties.getTimeoutMs() + " ms", e);
        }
    }

    public static JsonNode vector(float[] vector) {
        ArrayNode array = JSON.createArrayNode();
        for (float v : vector) {
            array.add(v);
        }
        return array;
    }

    public static JsonNode multiVector(List<float[]> vectors) {
        ArrayNode array = JSON.createArrayNode();
        vectors.forEach(v -> array.add(vector(v)));
        return array;
    }

    public static JsonNode sparse(SparseVector vector) {
        ObjectNode node = JSON.createObjectNode();
        ArrayNode indices = node.putArray("indices");
        vector.indices().forEach(indices::add);
        ArrayNode values = node.putArray("values");
        vector.values().forEach(values::add);
        return node;
    }
}
