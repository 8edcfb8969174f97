package com.router.service.impl;

import com.router.retrieval.Bm25SparseEncoder;
import com.router.retrieval.Embeddings;
import com.router.retrieval.LateInteractionEncoder;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingServiceImplTest {

    @Mock
    private EmbeddingModel embeddingModel;

    private EmbeddingServiceImpl embeddingService;

    @BeforeEach
    void setUp() {
        embeddingService = new EmbeddingServiceImpl(embeddingModel, new Bm25SparseEncoder(),
                new LateInteractionEncoder(embeddingModel));
        when(embeddingModel.embed(anyString())).thenReturn(Response.from(Embedding.from(new float[]{0.1f, 0.2f, 0.3f, 0.4f})));
    }

    @SuppressWarnings("unchecked")
    private void tokenVectors() {
        when(embeddingModel.embedAll(anyList())).thenAnswer(inv -> {
            List<TextSegment> segments = inv.getArgument(0);
            return Response.from(segments.stream()
                    .map(s -> Embedding.from(new float[]{s.text().length(), 1f, 0f, 0f}))
                    .toList());
        });
    }

    @Test
    void embedDocument_shouldEncodeAllThreeSpaces() {
        tokenVectors();

        Embeddings embeddings = embeddingService.embedDocument("List the issues of a repository");

        assertThat(embeddings.denseDimension()).isEqualTo(4);
        assertThat(embeddings.lateDimension()).isEqualTo(4);
        assertThat(embeddings.late()).hasSize(6);
        assertThat(embeddings.sparse().indices()).hasSize(3);
    }

    @Test
    void embedQuery_shouldCapTokenVectors() {
        tokenVectors();
        String longQuery = String.join(" ", java.util.Collections.nCopies(50, "issue"));

        Embeddings embeddings = embeddingService.embedQuery(longQuery);

        assertThat(embeddings.late()).hasSize(LateInteractionEncoder.QUERY_TOKEN_LIMIT);
        assertThat(embeddings.sparse().values()).containsExactly(1.0f);
        ArgumentCaptor<List<TextSegment>> segments = ArgumentCaptor.forClass(List.class);
        verify(embeddingModel).embedAll(segments.capture());
        assertThat(segments.getValue()).hasSize(32);
    }

    @Test
    void embedQuery_shouldFallBackToWholeTextWithoutTokens() {
        Embeddings embeddings = embeddingService.embedQuery("?!");

        assertThat(embeddings.late()).hasSize(1);
        assertThat(embeddings.sparse().isEmpty()).isTrue();
    }
}
