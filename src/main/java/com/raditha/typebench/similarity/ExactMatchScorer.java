package com.raditha.typebench.similarity;

import com.raditha.typebench.model.TypeNode;
import org.jspecify.annotations.Nullable;

/**
 * Binary equality of two normalized type trees.
 * Union members compare as an unordered set; every other argument list is ordered.
 */
public class ExactMatchScorer {

    /**
     * @return 1 when the prediction is present and structurally equal to the truth, else 0
     */
    public int exact(@Nullable TypeNode predicted, TypeNode truth) {
        return predicted != null && predicted.structurallyEquals(truth) ? 1 : 0;
    }
}
