package com.raditha.typebench.analyzer;

import com.raditha.typebench.model.ScoreRecord;
import com.raditha.typebench.model.Variable;

import java.util.List;

/**
 * Per-variable outcome of comparing one repository's predictions with its ground truth.
 *
 * @param repo      repository name
 * @param variables scoring targets, in ground-truth source order
 * @param records   one score record per variable, same order
 */
public record RepoAnalysis(String repo, List<Variable> variables, List<ScoreRecord> records) {

    public RepoAnalysis {
        variables = List.copyOf(variables);
        records = List.copyOf(records);
    }

    public long missingCount() {
        return records.stream().filter(ScoreRecord::missing).count();
    }
}
