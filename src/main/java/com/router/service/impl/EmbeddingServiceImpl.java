package com.router.service.impl;

import com.router.retrieval.Bm25SparseEncoder;
import com.router.retrieval.Embeddings;
import com.router.retrieval.LateInteractionEncoder;
import com.router.service.api.EmbeddingService;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

/**
 * Computes the three representations stored per operation: the sentence embedding, BM25 term
 * weights and per-token vectors for late interaction.
 */
@Service
public class EmbeddingServiceImpl implements EmbeddingService {

    private final EmbeddingModel embeddingModel;
    private final Bm25SparseEncoder sparseEncoder;
    private final LateInteractionEncoder lateEncoder;

    public EmbeddingServiceImpl(EmbeddingModel embeddingModel, Bm25SparseEncoder sparseEncoder,
                                LateInteractionEncoder lateEncoder) {
        this.embeddingModel = embeddingModel;
        this.sparseEncoder = sparseEncoder;
        this.lateEncoder = lateEncoder;
    }

    /**
     * Embeds an operation document; late-interaction tokens are capped at
     * {@link LateInteractionEncoder#DOCUMENT_TOKEN_LIMIT}.
     */
    @Override
    public Embeddings embedDocument(String text) {
        return new Embeddings(
                embeddingModel.embed(text).content().vector(),
                sparseEncoder.encodeDocument(text),
                lateEncoder.encode(text, LateInteractionEncoder.DOCUMENT_TOKEN_LIMIT));
    }

    /**
     * Embeds a search query; late-interaction tokens are capped at
     * {@link LateInteractionEncoder#QUERY_TOKEN_LIMIT}.
     */
    @Override
    public Embeddings embedQuery(String text) {
        return new Embeddings(
                embeddingModel.embed(text).content().vector(),
                sparseEncoder.encodeQuery(text),
                lateEncoder.encode(text, LateInteractionEncoder.QUERY_TOKEN_LIMIT));
    }
}
