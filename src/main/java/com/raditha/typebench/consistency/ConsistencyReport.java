package com.raditha.typebench.consistency;

/**
 * Checker outcomes for both variants of a repository.
 *
 * @param truthOutcome      ground-truth annotated variant (repo_a)
 * @param predictionOutcome prediction annotated variant (repo_b)
 */
public record ConsistencyReport(CheckerOutcome truthOutcome, CheckerOutcome predictionOutcome) {

    /**
     * Whether both variants produced a usable checker result.
     */
    public boolean complete() {
        return truthOutcome.available() && predictionOutcome.available();
    }
}
