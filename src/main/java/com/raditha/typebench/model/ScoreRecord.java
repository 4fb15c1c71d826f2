package com.raditha.typebench.model;

import org.jspecify.annotations.Nullable;

/**
 * Per-variable scoring outcome. Immutable once computed and persisted in the cache as-is.
 *
 * @param variable       qualified name of the variable
 * @param similarity     TypeSim score in [0, 1]
 * @param exact          1 for an exact match after normalization, else 0
 * @param depth          ground-truth depth
 * @param truthLabel     canonical rendering of the ground-truth type
 * @param predictedLabel canonical rendering of the prediction, {@code null} if missing
 * @param missing        true when no prediction exists
 */
public record ScoreRecord(
        String variable,
        double similarity,
        int exact,
        int depth,
        String truthLabel,
        @Nullable String predictedLabel,
        boolean missing) {

    public ScoreRecord {
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be between 0.0 and 1.0, got " + similarity);
        }
        if (exact != 0 && exact != 1) {
            throw new IllegalArgumentException("exact must be 0 or 1, got " + exact);
        }
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be >= 1");
        }
    }
}
