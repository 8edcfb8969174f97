package com.router.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.router.config.RetrievalProperties;
import com.router.model.OperationDocument;
import com.router.retrieval.Embeddings;
import com.router.retrieval.PayloadMapper;
import com.router.retrieval.QdrantRestClient;
import com.router.service.api.DocumentStore;
import com.router.service.api.EmbeddingService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link DocumentStore} on Qdrant: one collection per namespace, created lazily on first insert.
 */
@Service
@Slf4j
public class QdrantDocumentStore implements DocumentStore {

    private final QdrantRestClient client;
    private final EmbeddingService embeddingService;
    private final PayloadMapper payloadMapper;
    private final RetrievalProperties retrieval;
    private final Set<String> knownCollections = ConcurrentHashMap.newKeySet();

    public QdrantDocumentStore(QdrantRestClient client, EmbeddingService embeddingService,
                               PayloadMapper payloadMapper, RetrievalProperties retrieval) {
        this.client = client;
        this.embeddingService = embeddingService;
        this.payloadMapper = payloadMapper;
        this.retrieval = retrieval;
    }

    @Override
    public String insert(String namespace, String text, Map<String, Object> metadata) {
        Embeddings embeddings = embeddingService.embedDocument(text);
        ensureCollection(namespace, embeddings);

        String id = UUID.randomUUID().toString();
        Map<String, Object> payload = new LinkedHashMap<>(metadata);
        payload.put(PayloadMapper.TEXT_KEY, text);

        Map<String, JsonNode> vectors = new LinkedHashMap<>();
        vectors.put(retrieval.getDenseVector(), QdrantRestClient.vector(embeddings.dense()));
        vectors.put(retrieval.getSparseVector(), QdrantRestClient.sparse(embeddings.sparse()));
        vectors.put(retrieval.getLateVector(), QdrantRestClient.multiVector(embeddings.late()));

        client.upsertPoint(namespace, id, vectors, payload);
        log.info("Inserted document {} into namespace '{}'", id, namespace);
        return id;
    }

    @Override
    public void editPayload(String namespace, String id, Map<String, Object> metadata) {
        client.overwritePayload(namespace, id, metadata);
        log.info("Replaced payload of document {} in namespace '{}'", id, namespace);
    }

    @Override
    public List<OperationDocument> list(String namespace) {
        return client.scroll(namespace).stream()
                .map(point -> payloadMapper.toDocument(point.pointId(), namespace, PayloadMapper.metadataOf(point.payload())))
                .toList();
    }

    private synchronized void ensureCollection(String namespace, Embeddings embeddings) {
        if (knownCollections.contains(namespace)) {
            return;
        }
        if (!client.collectionExists(namespace)) {
            client.createCollection(namespace, embeddings.denseDimension(), embeddings.lateDimension(),
                    retrieval.getDenseVector(), retrieval.getSparseVector(), retrieval.getLateVector());
        }
        knownCollections.add(namespace);
    }
}
