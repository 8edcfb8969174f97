package com.router.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Hybrid retrieval tuning.
 */
@Data
@ConfigurationProperties(prefix = "retrieval")
public class RetrievalProperties {

    /**
     * Upper bound of the fused candidate list; larger configured values are lowered to it.
     */
    public static final int CANDIDATE_CAP = 5;

    /**
     * Nearest neighbours fetched from each embedding space.
     */
    private int perSpaceLimit = 20;

    /**
     * Candidates kept after fusion.
     */
    private int finalLimit = CANDIDATE_CAP;

    public int effectiveFinalLimit() {
        return Math.max(1, Math.min(finalLimit, CANDIDATE_CAP));
    }

    /**
     * The {@code k} of reciprocal rank fusion, {@code 1 / (k + rank)}.
     */
    private int rrfK = 2;

    private String denseVector = "dense";

    private String sparseVector = "bm25";

    private String lateVector = "late";
}
