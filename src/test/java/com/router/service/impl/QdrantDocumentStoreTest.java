package com.router.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.router.config.QdrantProperties;
import com.router.config.RetrievalProperties;
import com.router.model.OperationDocument;
import com.router.retrieval.Embeddings;
import com.router.retrieval.PayloadMapper;
import com.router.retrieval.QdrantRestClient;
import com.router.retrieval.SparseVector;
import com.router.service.api.EmbeddingService;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QdrantDocumentStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer mockQdrant;
    private QdrantDocumentStore store;

    @Mock
    private EmbeddingService embeddingService;

    @BeforeEach
    void setUp() throws IOException {
        mockQdrant = new MockWebServer();
        mockQdrant.start();
        QdrantProperties qdrant = new QdrantProperties();
        qdrant.setUrl(String.format("http://localhost:%s", mockQdrant.getPort()));
        QdrantRestClient client = new QdrantRestClient(WebClient.builder().build(), qdrant);
        store = new QdrantDocumentStore(client, embeddingService, new PayloadMapper(), new RetrievalProperties());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockQdrant.shutdown();
    }

    private static MockResponse ok(String result) {
        return new MockResponse()
                .setBody("{\"result\":" + result + ",\"status\":\"ok\"}")
                .addHeader("Content-Type", "application/json");
    }

    private void stubEmbeddings() {
        when(embeddingService.embedDocument(anyString())).thenReturn(new Embeddings(
                new float[]{0.1f, 0.2f, 0.3f},
                new SparseVector(List.of(11), List.of(1.2f)),
                List.of(new float[]{0.5f, 0.6f, 0.7f}, new float[]{0.8f, 0.9f, 1.0f})));
    }

    @Test
    void insert_shouldCreateCollectionOnFirstInsertOnly() throws Exception {
        // --- Arrange ---
        stubEmbeddings();
        mockQdrant.enqueue(ok("{\"exists\":false}"));
        mockQdrant.enqueue(ok("true"));
        mockQdrant.enqueue(ok("{\"operation_id\":1,\"status\":\"completed\"}"));
        mockQdrant.enqueue(ok("{\"operation_id\":2,\"status\":\"completed\"}"));

        // --- Act ---
        String first = store.insert("github", "List issues of a repository", Map.of("url", "/issues", "method", "GET"));
        String second = store.insert("github", "Create an issue", Map.of("url", "/issues", "method", "POST"));

        // --- Assert ---
        assertThat(first).isNotEqualTo(second);
        assertThat(mockQdrant.getRequestCount()).isEqualTo(4);

        assertThat(mockQdrant.takeRequest().getPath()).isEqualTo("/collections/github/exists");

        RecordedRequest create = mockQdrant.takeRequest();
        assertThat(create.getMethod()).isEqualTo("PUT");
        assertThat(create.getPath()).isEqualTo("/collections/github");
        JsonNode config = objectMapper.readTree(create.getBody().readUtf8());
        assertThat(config.at("/vectors/dense/size").asInt()).isEqualTo(3);
        assertThat(config.at("/vectors/dense/distance").asText()).isEqualTo("Cosine");
        assertThat(config.at("/vectors/late/multivector_config/comparator").asText()).isEqualTo("max_sim");
        assertThat(config.at("/sparse_vectors/bm25/modifier").asText()).isEqualTo("idf");

        RecordedRequest upsert = mockQdrant.takeRequest();
        assertThat(upsert.getPath()).isEqualTo("/collections/github/points?wait=true");
        JsonNode point = objectMapper.readTree(upsert.getBody().readUtf8()).at("/points/0");
        assertThat(point.get("id").asText()).isEqualTo(first);
        assertThat(point.at("/payload/text").asText()).isEqualTo("List issues of a repository");
        assertThat(point.at("/payload/url").asText()).isEqualTo("/issues");
        assertThat(point.at("/vector/late")).hasSize(2);
        assertThat(point.at("/vector/bm25/indices/0").asInt()).isEqualTo(11);

        assertThat(mockQdrant.takeRequest().getPath()).isEqualTo("/collections/github/points?wait=true");
    }

    @Test
    void list_shouldReturnInsertedMetadataWithoutText() throws Exception {
        // --- Arrange ---
        stubEmbeddings();
        mockQdrant.enqueue(ok("{\"exists\":true}"));
        mockQdrant.enqueue(ok("{\"operation_id\":1,\"status\":\"completed\"}"));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("url", "/repos/{owner}/{repo}/issues");
        metadata.put("method", "get");
        metadata.put("description", "List repository issues");
        metadata.put("parameters", "{\"type\":\"object\",\"properties\":{\"state\":{\"type\":\"string\"}},\"required\":[]}");
        String id = store.insert("github", "List repository issues", metadata);

        mockQdrant.takeRequest();
        JsonNode storedPayload = objectMapper.readTree(mockQdrant.takeRequest().getBody().readUtf8()).at("/points/0/payload");
        mockQdrant.enqueue(ok("{\"points\":[{\"id\":\"" + id + "\",\"payload\":" + storedPayload + "}],\"next_page_offset\":null}"));

        // --- Act ---
        List<OperationDocument> documents = store.list("github");

        // --- Assert ---
        assertThat(documents).hasSize(1);
        OperationDocument document = documents.get(0);
        assertThat(document.pointId()).isEqualTo(id);
        assertThat(document.namespace()).isEqualTo("github");
        assertThat(document.url()).isEqualTo(metadata.get("url"));
        assertThat(document.method()).isEqualTo("GET");
        assertThat(document.description()).isEqualTo(metadata.get("description"));
        assertThat(document.parameters().declaredNames()).containsExactly("state");

        Map<String, Object> roundTripped = PayloadMapper.metadataOf(
                objectMapper.convertValue(storedPayload, Map.class));
        assertThat(roundTripped).isEqualTo(metadata);
    }

    @Test
    void editPayload_shouldOverwriteWholePayload() throws Exception {
        mockQdrant.enqueue(ok("{\"operation_id\":3,\"status\":\"completed\"}"));

        store.editPayload("github", "point-1", Map.of("description", "updated"));

        RecordedRequest request = mockQdrant.takeRequest();
        assertThat(request.getMethod()).isEqualTo("PUT");
        assertThat(request.getPath()).isEqualTo("/collections/github/points/payload?wait=true");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.at("/points/0").asText()).isEqualTo("point-1");
        assertThat(body.at("/payload/description").asText()).isEqualTo("updated");
    }

    @Test
    void list_shouldFollowScrollPages() {
        mockQdrant.enqueue(ok("{\"points\":[{\"id\":\"a\",\"payload\":{\"url\":\"/a\",\"method\":\"GET\"}}],\"next_page_offset\":\"b\"}"));
        mockQdrant.enqueue(ok("{\"points\":[{\"id\":\"b\",\"payload\":{\"url\":\"/b\",\"method\":\"POST\"}}],\"next_page_offset\":null}"));

        List<OperationDocument> documents = store.list("github");

        assertThat(documents).extracting(OperationDocument::operationKey).containsExactly("GET /a", "POST /b");
    }
}
