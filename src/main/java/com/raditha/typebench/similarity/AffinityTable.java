package com.raditha.typebench.similarity;

import com.raditha.typebench.config.SimilarityPolicy;
import com.raditha.typebench.model.ConstructorKind;
import com.raditha.typebench.model.TypeNode;

import java.util.EnumMap;
import java.util.Map;

/**
 * Local credit for comparing two constructors, ignoring their arguments.
 * <ul>
 * <li>identical canonical name: 1.0</li>
 * <li>same kind, different name: the policy's same-kind credit, except for
 * nominal kinds (user classes, literal values, raw text) which get 0.0</li>
 * <li>different kinds: the symmetric table entry, 0.0 when absent</li>
 * </ul>
 */
public class AffinityTable {

    private final Map<ConstructorKind, Map<ConstructorKind, Double>> table = new EnumMap<>(ConstructorKind.class);
    private final double sameKindCredit;

    public AffinityTable(SimilarityPolicy policy) {
        this.sameKindCredit = policy.sameKindCredit();
        for (SimilarityPolicy.AffinityRule rule : policy.affinities()) {
            put(rule.first(), rule.second(), rule.score());
            put(rule.second(), rule.first(), rule.score());
        }
    }

    private void put(ConstructorKind from, ConstructorKind to, double score) {
        table.computeIfAbsent(from, k -> new EnumMap<>(ConstructorKind.class)).put(to, score);
    }

    /**
     * Credit for the outer constructors of two nodes.
     *
     * @return value in [0, 1], symmetric in its arguments
     */
    public double affinity(TypeNode predicted, TypeNode truth) {
        if (predicted.kind() == truth.kind()) {
            if (predicted.name().equals(truth.name())) {
                return 1.0;
            }
            return predicted.kind().isNominal() ? 0.0 : sameKindCredit;
        }
        return kindAffinity(predicted.kind(), truth.kind());
    }

    /**
     * Table entry for two distinct kinds.
     */
    public double kindAffinity(ConstructorKind first, ConstructorKind second) {
        if (first == second) {
            return 1.0;
        }
        Map<ConstructorKind, Double> row = table.get(first);
        if (row == null) {
            return 0.0;
        }
        return row.getOrDefault(second, 0.0);
    }
}
