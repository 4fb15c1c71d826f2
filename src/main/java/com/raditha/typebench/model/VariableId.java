package com.raditha.typebench.model;

/**
 * Stable identity of an annotated variable, parameter or return slot.
 *
 * @param file          repository-relative source file
 * @param qualifiedName dotted name, {@code pkg.mod.func@arg} for parameters and
 *                      {@code pkg.mod.func::return} for return types
 * @param line          1-based line of the annotation in {@code file}
 */
public record VariableId(String file, String qualifiedName, int line) {

    /**
     * Key used to pair a ground-truth variable with its prediction.
     * Locations shift when annotations are inserted, so only the qualified name takes part.
     */
    public String key() {
        return qualifiedName;
    }

    @Override
    public String toString() {
        return qualifiedName + " (" + file + ":" + line + ")";
    }
}
