package com.raditha.typebench.workflow;

import com.raditha.typebench.metrics.RepoResult;

import java.util.Comparator;
import java.util.List;

/**
 * Outcome of a batch: exactly one evaluation per requested repository, sorted by name.
 */
public record EvaluationSummary(List<RepoEvaluation> evaluations) {

    public EvaluationSummary {
        evaluations = evaluations.stream()
                .sorted(Comparator.comparing(RepoEvaluation::repo))
                .toList();
    }

    public List<RepoResult> rows() {
        return evaluations.stream().map(RepoEvaluation::result).toList();
    }

    public long failureCount() {
        return evaluations.stream().filter(e -> e.result().isFailure()).count();
    }

    public long cacheHits() {
        return evaluations.stream().filter(RepoEvaluation::fromCache).count();
    }
}
