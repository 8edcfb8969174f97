package com.router.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Produces one fixed-width vector per token, compared by the vector store with MAX_SIM.
 * Token vectors come from the same sentence model as the dense space.
 */
@Component
public class LateInteractionEncoder {

    public static final int DOCUMENT_TOKEN_LIMIT = 180;
    public static final int QUERY_TOKEN_LIMIT = 32;

    private final EmbeddingModel embeddingModel;

    public LateInteractionEncoder(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    /**
     * @param text       the text to encode
     * @param tokenLimit maximum number of token vectors
     * @return at least one vector; text without tokens is encoded as a whole
     */
    public List<float[]> encode(String text, int tokenLimit) {
        List<String> tokens = Tokenizer.words(text);
        if (tokens.isEmpty()) {
            return List.of(embeddingModel.embed(text == null || text.isBlank() ? " " : text).content().vector());
        }
        List<TextSegment> segments = tokens.stream()
                .limit(tokenLimit)
                .map(TextSegment::from)
                .toList();
        List<float[]> vectors = new ArrayList<>(segments.size());
        for (Embedding embedding : embeddingModel.embedAll(segments).content()) {
            vectors.add(embedding.vector());
        }
        return vectors;
    }
}
