package com.raditha.typebench.config;

import com.raditha.typebench.model.ConstructorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Tunable policy parameters of the TypeSim scorer.
 *
 * @param localWeight    share of a node's score taken from its own constructor credit;
 *                       the rest comes from the average over its children (0.0-1.0)
 * @param sameKindCredit credit for two different names of the same constructor kind,
 *                       e.g. {@code Iterator} against {@code Generator} (0.0-1.0)
 * @param affinities     partial credit for related constructor kinds, symmetric
 */
public record SimilarityPolicy(
        double localWeight,
        double sameKindCredit,
        List<AffinityRule> affinities) {

    /** Default blend: the constructor and its arguments count equally. */
    public static final double DEFAULT_LOCAL_WEIGHT = 0.5;

    /** Default credit for same-kind, different-name constructors. */
    public static final double DEFAULT_SAME_KIND_CREDIT = 0.75;

    /** Credit for closely related families such as list and Sequence. */
    public static final double RELATED_CREDIT = 0.5;

    /** Credit for distant relatives such as int and complex. */
    public static final double DISTANT_CREDIT = 0.25;

    /**
     * One entry of the constructor-affinity table.
     *
     * @param first  one constructor kind
     * @param second the other constructor kind
     * @param score  partial credit in [0, 1]
     */
    public record AffinityRule(ConstructorKind first, ConstructorKind second, double score) {
        public AffinityRule {
            if (first == null || second == null) {
                throw new IllegalArgumentException("affinity kinds cannot be null");
            }
            if (score < 0.0 || score > 1.0) {
                throw new IllegalArgumentException(
                        String.format(Locale.ROOT, "affinity score must be between 0.0 and 1.0, got %.3f", score));
            }
        }
    }

    /**
     * Validate policy.
     */
    public SimilarityPolicy {
        if (localWeight < 0.0 || localWeight > 1.0) {
            throw new IllegalArgumentException("localWeight must be between 0.0 and 1.0");
        }
        if (sameKindCredit < 0.0 || sameKindCredit > 1.0) {
            throw new IllegalArgumentException("sameKindCredit must be between 0.0 and 1.0");
        }
        affinities = affinities == null ? List.of() : List.copyOf(affinities);
    }

    /**
     * The default policy and affinity table.
     */
    public static SimilarityPolicy defaults() {
        return new SimilarityPolicy(DEFAULT_LOCAL_WEIGHT, DEFAULT_SAME_KIND_CREDIT, defaultAffinities());
    }

    /**
     * Same policy with some table entries replaced or added.
     * Later rules win over earlier ones for the same pair of kinds.
     */
    public SimilarityPolicy withOverrides(double localWeight, double sameKindCredit, List<AffinityRule> overrides) {
        List<AffinityRule> merged = new ArrayList<>(affinities);
        merged.addAll(overrides);
        return new SimilarityPolicy(localWeight, sameKindCredit, merged);
    }

    /**
     * Stable text describing every parameter. Cached scores are keyed on it so
     * that a policy change never reuses stale scores.
     */
    public String fingerprint() {
        return String.format(Locale.ROOT, "local=%.6f;same=%.6f;", localWeight, sameKindCredit)
                + affinities.stream()
                        .map(r -> String.format(Locale.ROOT, "%s~%s=%.6f", r.first(), r.second(), r.score()))
                        .collect(Collectors.joining(";"));
    }

    private static List<AffinityRule> defaultAffinities() {
        return List.of(
                // list-like and sequence-like
                new AffinityRule(ConstructorKind.LIST, ConstructorKind.SEQUENCE, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.LIST, ConstructorKind.ITERABLE, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.LIST, ConstructorKind.TUPLE, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.TUPLE, ConstructorKind.SEQUENCE, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.TUPLE, ConstructorKind.ITERABLE, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.SEQUENCE, ConstructorKind.ITERABLE, RELATED_CREDIT),
                // set-like
                new AffinityRule(ConstructorKind.SET, ConstructorKind.FROZENSET, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.SET, ConstructorKind.ABSTRACT_SET, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.FROZENSET, ConstructorKind.ABSTRACT_SET, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.SET, ConstructorKind.ITERABLE, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.ABSTRACT_SET, ConstructorKind.ITERABLE, RELATED_CREDIT),
                // mapping-like
                new AffinityRule(ConstructorKind.DICT, ConstructorKind.MAPPING, RELATED_CREDIT),
                // numeric tower
                new AffinityRule(ConstructorKind.BOOL, ConstructorKind.INT, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.INT, ConstructorKind.FLOAT, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.FLOAT, ConstructorKind.COMPLEX, RELATED_CREDIT),
                new AffinityRule(ConstructorKind.INT, ConstructorKind.COMPLEX, DISTANT_CREDIT),
                // text
                new AffinityRule(ConstructorKind.STR, ConstructorKind.BYTES, RELATED_CREDIT));
    }
}
