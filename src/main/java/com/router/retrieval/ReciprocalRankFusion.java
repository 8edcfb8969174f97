package com.router.retrieval;

import com.router.model.Candidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges several ranked lists into one with Reciprocal Rank Fusion.
 * <p>
 * A point scores {@code 1 / (k + rank)} in every list it appears in (1-based rank, first
 * occurrence only) and nothing in the others. The fused list is ordered by descending score,
 * ties broken by ascending point id, so the order is total and reproducible.
 */
public final class ReciprocalRankFusion {

    private static final Comparator<Map.Entry<String, Double>> BY_SCORE_THEN_ID =
            Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.<String, Double>comparingByKey());

    private ReciprocalRankFusion() {
    }

    /**
     * @param rankings ranked lists, best first
     * @param k        the fusion constant
     * @param limit    maximum number of fused candidates
     * @return at most {@code limit} candidates without duplicate ids
     */
    public static List<Candidate> fuse(List<List<RankedPoint>> rankings, int k, int limit) {
        Map<String, Double> scores = new HashMap<>();
        Map<String, Map<String, Object>> payloads = new HashMap<>();

        for (List<RankedPoint> ranking : rankings) {
            Set<String> seen = new HashSet<>();
            int rank = 0;
            for (RankedPoint point : ranking) {
                if (!seen.add(point.pointId())) {
                    continue;
                }
                rank++;
                scores.merge(point.pointId(), 1.0 / (k + rank), Double::sum);
                payloads.putIfAbsent(point.pointId(), point.payload());
            }
        }

        List<Map.Entry<String, Double>> ordered = new ArrayList<>(scores.entrySet());
        ordered.sort(BY_SCORE_THEN_ID);

        List<Candidate> fused = new ArrayList<>();
        for (int i = 0; i < ordered.size() && i < limit; i++) {
            Map.Entry<String, Double> entry = ordered.get(i);
            fused.add(new Candidate(entry.getKey(), payloads.get(entry.getKey()), entry.getValue(), i + 1));
        }
        return fused;
    }
}
