package com.router.service.api;

import com.router.retrieval.Embeddings;

/**
 * Encodes text into the dense, sparse and late-interaction spaces.
 */
public interface EmbeddingService {

    Embeddings embedDocument(String text);

    Embeddings embedQuery(String text);
}
