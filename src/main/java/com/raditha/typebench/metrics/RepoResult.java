package com.raditha.typebench.metrics;

import com.raditha.typebench.model.MetricValue;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the summary: the statistics of a single repository.
 *
 * @param repo          repository name
 * @param values        tabular fields in column order, keyed by column name
 * @param supplementary figures reported in the JSON export only
 * @param failureReason why the repository could not be evaluated, {@code null} for a normal row
 */
public record RepoResult(
        String repo,
        Map<String, MetricValue> values,
        Map<String, MetricValue> supplementary,
        @Nullable String failureReason) {

    public RepoResult {
        if (repo == null || repo.isBlank()) {
            throw new IllegalArgumentException("repo name cannot be blank");
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        supplementary = Collections.unmodifiableMap(new LinkedHashMap<>(supplementary));
    }

    /**
     * Value of a column, {@code N/A} if the row does not have it.
     */
    public MetricValue get(String column) {
        return values.getOrDefault(column, MetricValue.notApplicable());
    }

    public boolean isFailure() {
        return failureReason != null;
    }
}
