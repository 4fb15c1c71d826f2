package com.raditha.typebench.workflow;

import com.raditha.typebench.metrics.RepoResult;
import com.raditha.typebench.model.ScoreRecord;

import java.util.List;

/**
 * What one worker produced for one repository.
 *
 * @param result    the summary row
 * @param records   per-variable scores, empty for a failure row
 * @param fromCache whether the scores and checker outcomes came from the cache
 */
public record RepoEvaluation(RepoResult result, List<ScoreRecord> records, boolean fromCache) {

    public RepoEvaluation {
        records = List.copyOf(records);
    }

    public String repo() {
        return result.repo();
    }
}
