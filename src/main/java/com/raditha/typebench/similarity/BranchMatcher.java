package com.raditha.typebench.similarity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pairs union branches by best score rather than by position.
 * <p>
 * Every (truth, predicted) pair is ranked by score, highest first. Ties go to
 * the lower truth index and then the lower predicted index. Pairs are taken
 * greedily, each branch at most once. Unmatched branches on either side add
 * nothing, so the caller's normalization by the larger side is the only way
 * they affect the result.
 */
public class BranchMatcher {

    /**
     * A chosen pairing.
     *
     * @param truthIndex     index into the truth branches
     * @param predictedIndex index into the predicted branches
     * @param score          similarity of the pair
     */
    public record Match(int truthIndex, int predictedIndex, double score) {
    }

    /**
     * Match branches given the full score matrix.
     *
     * @param scores {@code scores[t][p]} is the similarity of predicted branch p to truth branch t
     * @return chosen pairs in the order they were taken
     */
    public List<Match> match(double[][] scores) {
        List<Match> candidates = new ArrayList<>();
        for (int t = 0; t < scores.length; t++) {
            for (int p = 0; p < scores[t].length; p++) {
                candidates.add(new Match(t, p, scores[t][p]));
            }
        }
        candidates.sort(Comparator.comparingDouble(Match::score).reversed()
                .thenComparingInt(Match::truthIndex)
                .thenComparingInt(Match::predictedIndex));

        int predictedCount = scores.length == 0 ? 0 : scores[0].length;
        boolean[] truthUsed = new boolean[scores.length];
        boolean[] predictedUsed = new boolean[predictedCount];
        List<Match> chosen = new ArrayList<>();
        for (Match candidate : candidates) {
            if (truthUsed[candidate.truthIndex()] || predictedUsed[candidate.predictedIndex()]) {
                continue;
            }
            truthUsed[candidate.truthIndex()] = true;
            predictedUsed[candidate.predictedIndex()] = true;
            chosen.add(candidate);
        }
        return chosen;
    }

    /**
     * Sum of matched scores divided by the larger branch count.
     */
    public double matchedAverage(double[][] scores, int truthCount, int predictedCount) {
        int denominator = Math.max(truthCount, predictedCount);
        if (denominator == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (Match m : match(scores)) {
            sum += m.score();
        }
        return sum / denominator;
    }
}
