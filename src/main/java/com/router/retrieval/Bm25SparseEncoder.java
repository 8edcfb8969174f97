package com.router.retrieval;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.codec.digest.MurmurHash3;
import org.springframework.stereotype.Component;

/**
 * Encodes text as BM25 term weights over hashed token ids.
 * <p>
 * Documents carry the saturated, length-normalised term frequency; queries carry weight 1 per
 * distinct term. The inverse document frequency is applied by the vector store at query time,
 * so the collection's sparse space must be created with the {@code idf} modifier.
 */
@Component
public class Bm25SparseEncoder {

    static final double K1 = 1.2;
    static final double B = 0.75;
    static final double AVERAGE_LENGTH = 256.0;

    public SparseVector encodeDocument(String text) {
        List<String> terms = Tokenizer.terms(text);
        Map<Integer, Integer> frequencies = new LinkedHashMap<>();
        for (String term : terms) {
            frequencies.merge(tokenId(term), 1, Integer::sum);
        }
        double lengthNorm = 1 - B + B * terms.size() / AVERAGE_LENGTH;
        List<Integer> indices = new ArrayList<>(frequencies.size());
        List<Float> values = new ArrayList<>(frequencies.size());
        frequencies.forEach((id, tf) -> {
            indices.add(id);
            values.add((float) (tf * (K1 + 1) / (tf + K1 * lengthNorm)));
        });
        return new SparseVector(indices, values);
    }

    public SparseVector encodeQuery(String text) {
        Map<Integer, Float> weights = new LinkedHashMap<>();
        for (String term : Tokenizer.terms(text)) {
            weights.put(tokenId(term), 1.0f);
        }
        return new SparseVector(new ArrayList<>(weights.keySet()), new ArrayList<>(weights.values()));
    }

    /**
     * Non-negative 31-bit token id.
     */
    static int tokenId(String term) {
        return MurmurHash3.hash32x86(term.getBytes(StandardCharsets.UTF_8)) & 0x7fffffff;
    }
}
