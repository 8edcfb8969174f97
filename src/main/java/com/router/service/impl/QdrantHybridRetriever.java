package com.router.service.impl;

import com.router.config.RetrievalProperties;
import com.router.model.Candidate;
import com.router.retrieval.Embeddings;
import com.router.retrieval.PayloadMapper;
import com.router.retrieval.QdrantRestClient;
import com.router.retrieval.RankedPoint;
import com.router.retrieval.ReciprocalRankFusion;
import com.router.service.api.EmbeddingService;
import com.router.service.api.HybridRetriever;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Searches the dense, sparse and late-interaction spaces of a namespace one after the other and
 * merges the three rankings with {@link ReciprocalRankFusion}.
 */
@Service
@Slf4j
public class QdrantHybridRetriever implements HybridRetriever {

    private final QdrantRestClient client;
    private final EmbeddingService embeddingService;
    private final RetrievalProperties properties;

    public QdrantHybridRetriever(QdrantRestClient client, EmbeddingService embeddingService, RetrievalProperties properties) {
        this.client = client;
        this.embeddingService = embeddingService;
        this.properties = properties;
    }

    @Override
    public List<Candidate> retrieve(String namespace, String query) {
        Embeddings embeddings = embeddingService.embedQuery(query);
        int limit = properties.getPerSpaceLimit();

        List<RankedPoint> dense = client.query(namespace, properties.getDenseVector(),
                QdrantRestClient.vector(embeddings.dense()), limit);
        List<RankedPoint> sparse = embeddings.sparse().isEmpty()
                ? List.of()
                : client.query(namespace, properties.getSparseVector(), QdrantRestClient.sparse(embeddings.sparse()), limit);
        List<RankedPoint> late = client.query(namespace, properties.getLateVector(),
                QdrantRestClient.multiVector(embeddings.late()), limit);

        List<Candidate> fused = ReciprocalRankFusion.fuse(List.of(dense, sparse, late), properties.getRrfK(), properties.effectiveFinalLimit())
                .stream()
                .map(c -> new Candidate(c.pointId(), PayloadMapper.metadataOf(c.payload()), c.score(), c.rank()))
                .toList();
        log.info("Retrieved {} candidates from '{}' (dense {}, sparse {}, late {})",
                fused.size(), namespace, dense.size(), sparse.size(), late.size());
        return fused;
    }
}
