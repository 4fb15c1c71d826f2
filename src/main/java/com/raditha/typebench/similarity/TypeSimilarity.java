package com.raditha.typebench.similarity;

import com.raditha.typebench.config.SimilarityPolicy;
import com.raditha.typebench.model.TypeNode;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * TypeSim: partial-credit similarity between a predicted and a ground-truth type tree.
 * <p>
 * A node's score blends the local constructor credit from the
 * {@link AffinityTable} with the average score of its arguments:
 * <pre>
 *   both have arguments : w * local + (1 - w) * childAverage
 *   one has arguments   : w * local
 *   neither             : local
 * </pre>
 * Arguments pair positionally; only {@code min(len)} pairs are scored and the
 * sum is divided by {@code max(len)}, so surplus or missing arguments cost
 * credit. Unions on either side are compared branch-wise through the
 * {@link BranchMatcher}, a non-union side counting as a single branch.
 * <p>
 * The function is pure and deterministic.
 */
public class TypeSimilarity {

    private final AffinityTable affinityTable;
    private final BranchMatcher branchMatcher;
    private final double localWeight;

    /**
     * Scorer with the default policy.
     */
    public TypeSimilarity() {
        this(SimilarityPolicy.defaults());
    }

    public TypeSimilarity(SimilarityPolicy policy) {
        this.affinityTable = new AffinityTable(policy);
        this.branchMatcher = new BranchMatcher();
        this.localWeight = policy.localWeight();
    }

    /**
     * Similarity of a prediction to the ground truth.
     *
     * @param predicted predicted type, {@code null} when missing
     * @param truth     ground-truth type
     * @return score in [0, 1]; 0 for a missing prediction, 1 for a structurally equal one
     */
    public double similarity(@Nullable TypeNode predicted, TypeNode truth) {
        if (predicted == null) {
            return 0.0;
        }
        return clamp(score(predicted, truth));
    }

    private double score(TypeNode predicted, TypeNode truth) {
        if (predicted.structurallyEquals(truth)) {
            return 1.0;
        }
        if (predicted.isUnion() || truth.isUnion()) {
            return compareBranches(branches(predicted), branches(truth));
        }

        double local = affinityTable.affinity(predicted, truth);
        if (predicted.hasChildren() && truth.hasChildren()) {
            double childAverage = comparePositional(predicted.children(), truth.children());
            return localWeight * local + (1.0 - localWeight) * childAverage;
        }
        if (predicted.hasChildren() || truth.hasChildren()) {
            return localWeight * local;
        }
        return local;
    }

    private static List<TypeNode> branches(TypeNode node) {
        return node.isUnion() ? node.children() : List.of(node);
    }

    private double compareBranches(List<TypeNode> predicted, List<TypeNode> truth) {
        double[][] scores = new double[truth.size()][predicted.size()];
        for (int t = 0; t < truth.size(); t++) {
            for (int p = 0; p < predicted.size(); p++) {
                scores[t][p] = score(predicted.get(p), truth.get(t));
            }
        }
        return branchMatcher.matchedAverage(scores, truth.size(), predicted.size());
    }

    private double comparePositional(List<TypeNode> predicted, List<TypeNode> truth) {
        int pairs = Math.min(predicted.size(), truth.size());
        double sum = 0.0;
        for (int i = 0; i < pairs; i++) {
            sum += score(predicted.get(i), truth.get(i));
        }
        return sum / Math.max(predicted.size(), truth.size());
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(1.0, score));
    }
}
