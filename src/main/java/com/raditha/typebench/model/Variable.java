package com.raditha.typebench.model;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * A scoring target: the ground-truth type of one variable and, when the
 * prediction set has an entry for it, the predicted type.
 *
 * @param id        variable identity
 * @param truth     ground-truth type, always present
 * @param predicted predicted type, {@code null} when the prediction is missing
 */
public record Variable(VariableId id, TypeNode truth, @Nullable TypeNode predicted) {

    public Variable {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(truth, "truth");
    }

    public boolean isMissing() {
        return predicted == null;
    }

    /**
     * Depth of the ground truth. Independent of the prediction.
     */
    public int depth() {
        return truth.depth();
    }
}
