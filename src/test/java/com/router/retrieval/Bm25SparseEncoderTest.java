package com.router.retrieval;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class Bm25SparseEncoderTest {

    private final Bm25SparseEncoder encoder = new Bm25SparseEncoder();

    @Test
    void encodeQuery_shouldWeightEachDistinctTermOnce() {
        SparseVector vector = encoder.encodeQuery("list the open issues, open issues only");

        // "the" is a stopword; open and issues collapse
        assertThat(vector.indices()).hasSize(4);
        assertThat(vector.values()).containsOnly(1.0f);
        assertThat(vector.indices()).contains(Bm25SparseEncoder.tokenId("open"), Bm25SparseEncoder.tokenId("issues"));
    }

    @Test
    void encodeDocument_shouldSaturateTermFrequency() {
        SparseVector vector = encoder.encodeDocument("issues issues repository");

        int issues = vector.indices().indexOf(Bm25SparseEncoder.tokenId("issues"));
        int repository = vector.indices().indexOf(Bm25SparseEncoder.tokenId("repository"));
        double norm = 1 - Bm25SparseEncoder.B + Bm25SparseEncoder.B * 3 / Bm25SparseEncoder.AVERAGE_LENGTH;
        double k1 = Bm25SparseEncoder.K1;

        assertThat((double) vector.values().get(issues)).isCloseTo(2 * (k1 + 1) / (2 + k1 * norm), within(1e-5));
        assertThat((double) vector.values().get(repository)).isCloseTo((k1 + 1) / (1 + k1 * norm), within(1e-5));
        assertThat(vector.values().get(issues)).isGreaterThan(vector.values().get(repository));
    }

    @Test
    void tokenId_shouldBeNonNegativeAndStable() {
        assertThat(Bm25SparseEncoder.tokenId("issues")).isEqualTo(Bm25SparseEncoder.tokenId("issues"));
        assertThat(Bm25SparseEncoder.tokenId("issues")).isNotNegative();
        assertThat(Bm25SparseEncoder.tokenId("pulls")).isNotNegative();
    }

    @Test
    void encode_shouldBeEmptyForStopwordsOnly() {
        assertThat(encoder.encodeQuery("the and of").isEmpty()).isTrue();
        assertThat(encoder.encodeDocument("").isEmpty()).isTrue();
    }
}
