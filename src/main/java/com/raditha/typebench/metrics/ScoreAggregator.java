package com.raditha.typebench.metrics;

import com.raditha.typebench.config.EvaluationConfig;
import com.raditha.typebench.consistency.CheckerOutcome;
import com.raditha.typebench.model.MetricValue;
import com.raditha.typebench.model.ScoreRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;

/**
 * Reduces the score records and checker outcomes of one repository to its summary row.
 * <p>
 * Every mean over an empty set is {@code N/A}; checker failures are {@code unavailable}.
 * Depth buckets run from 1 to the configured maximum depth, deeper types
 * falling into the last bucket. The {@code lower_than_k} averages group
 * records by their ground-truth label and average the per-group means of the
 * groups that occur fewer than {@code k} times in the repository.
 */
public class ScoreAggregator {

    public static final String TOTAL_VARS = "total_vars";
    public static final String OVERALL = "overall_score";
    public static final String OVERALL_WO_MISSING = "overall_score_wo_missing";
    public static final String OVERALL_EXACT = "overall_score_exact";
    public static final String OVERALL_WO_MISSING_EXACT = "overall_score_wo_missing_exact";
    public static final String MISSING_RATIO = "missing_ratio";
    public static final String REPO_A_CONSISTENCY = "repo_a_consistency";
    public static final String REPO_B_CONSISTENCY = "repo_b_consistency";
    public static final String REPO_A_NORMALIZED = "repo_a_normalized_consistency";
    public static final String REPO_B_NORMALIZED = "repo_b_normalized_consistency";

    private static final double NORMALIZATION_FACTOR = 10.0;

    private final int maxDepth;
    private final List<Integer> frequencyThresholds;

    public ScoreAggregator(EvaluationConfig config) {
        this(config.maxDepth(), config.frequencyThresholds());
    }

    ScoreAggregator(int maxDepth, List<Integer> frequencyThresholds) {
        this.maxDepth = maxDepth;
        this.frequencyThresholds = List.copyOf(frequencyThresholds);
    }

    public static String depthColumn(int depth, boolean exact) {
        return "depth_" + depth + "_score" + (exact ? "_exact" : "");
    }

    public static String lowerThanColumn(int threshold, boolean exact) {
        return "lower_than_" + threshold + "_average" + (exact ? "_exact" : "");
    }

    /**
     * Tabular columns after {@code repo_name}, in output order.
     */
    public List<String> columns() {
        List<String> columns = new ArrayList<>(List.of(
                TOTAL_VARS, OVERALL, OVERALL_WO_MISSING, OVERALL_EXACT, OVERALL_WO_MISSING_EXACT, MISSING_RATIO));
        for (int d = 1; d <= maxDepth; d++) {
            columns.add(depthColumn(d, false));
        }
        for (int d = 1; d <= maxDepth; d++) {
            columns.add(depthColumn(d, true));
        }
        columns.add(REPO_A_CONSISTENCY);
        columns.add(REPO_B_CONSISTENCY);
        for (int k : frequencyThresholds) {
            columns.add(lowerThanColumn(k, false));
        }
        for (int k : frequencyThresholds) {
            columns.add(lowerThanColumn(k, true));
        }
        return columns;
    }

    /**
     * Build the summary row of a repository.
     *
     * @param repo       repository name
     * @param records    one record per scoring target
     * @param truth      checker outcome of the ground-truth variant
     * @param prediction checker outcome of the prediction variant
     */
    public RepoResult aggregate(String repo, List<ScoreRecord> records,
                                CheckerOutcome truth, CheckerOutcome prediction) {
        Map<String, MetricValue> values = new LinkedHashMap<>();
        long total = records.size();
        List<ScoreRecord> present = records.stream().filter(r -> !r.missing()).toList();
        long missing = total - present.size();

        values.put(TOTAL_VARS, MetricValue.count(total));
        values.put(OVERALL, mean(records, ScoreRecord::similarity));
        values.put(OVERALL_WO_MISSING, mean(present, ScoreRecord::similarity));
        values.put(OVERALL_EXACT, mean(records, ScoreRecord::exact));
        values.put(OVERALL_WO_MISSING_EXACT, mean(present, ScoreRecord::exact));
        values.put(MISSING_RATIO, MetricValue.ratio(missing, total));

        Map<Integer, List<ScoreRecord>> buckets = new TreeMap<>();
        for (ScoreRecord record : records) {
            buckets.computeIfAbsent(Math.min(record.depth(), maxDepth), d -> new ArrayList<>()).add(record);
        }
        for (int d = 1; d <= maxDepth; d++) {
            values.put(depthColumn(d, false), mean(buckets.getOrDefault(d, List.of()), ScoreRecord::similarity));
        }
        for (int d = 1; d <= maxDepth; d++) {
            values.put(depthColumn(d, true), mean(buckets.getOrDefault(d, List.of()), ScoreRecord::exact));
        }

        values.put(REPO_A_CONSISTENCY, truth.consistency());
        values.put(REPO_B_CONSISTENCY, prediction.consistency());

        Map<String, List<ScoreRecord>> byLabel = new TreeMap<>();
        for (ScoreRecord record : records) {
            byLabel.computeIfAbsent(record.truthLabel(), l -> new ArrayList<>()).add(record);
        }
        for (int k : frequencyThresholds) {
            values.put(lowerThanColumn(k, false), rareLabelAverage(byLabel, k, ScoreRecord::similarity));
        }
        for (int k : frequencyThresholds) {
            values.put(lowerThanColumn(k, true), rareLabelAverage(byLabel, k, ScoreRecord::exact));
        }

        Map<String, MetricValue> supplementary = new LinkedHashMap<>();
        supplementary.put(REPO_A_NORMALIZED, normalizedConsistency(truth, total));
        supplementary.put(REPO_B_NORMALIZED, normalizedConsistency(prediction, total));

        return new RepoResult(repo, values, supplementary, null);
    }

    /**
     * A row for a repository that could not be evaluated: every field {@code N/A}.
     */
    public RepoResult failure(String repo, String reason) {
        Map<String, MetricValue> values = new LinkedHashMap<>();
        for (String column : columns()) {
            values.put(column, MetricValue.notApplicable());
        }
        return new RepoResult(repo, values, Map.of(), reason);
    }

    private static MetricValue mean(List<ScoreRecord> records, ToDoubleFunction<ScoreRecord> metric) {
        double sum = 0.0;
        for (ScoreRecord record : records) {
            sum += metric.applyAsDouble(record);
        }
        return MetricValue.ratio(sum, records.size());
    }

    private static MetricValue rareLabelAverage(Map<String, List<ScoreRecord>> byLabel, int threshold,
                                                ToDoubleFunction<ScoreRecord> metric) {
        double sumOfMeans = 0.0;
        int groups = 0;
        for (List<ScoreRecord> group : byLabel.values()) {
            if (group.size() < threshold) {
                sumOfMeans += mean(group, metric).asDouble();
                groups++;
            }
        }
        return MetricValue.ratio(sumOfMeans, groups);
    }

    /**
     * {@code exp(-count / totalVars * 10)}: 1.0 for a clean tree, falling toward 0 as
     * errors per variable grow.
     */
    static MetricValue normalizedConsistency(CheckerOutcome outcome, long totalVars) {
        if (!outcome.available()) {
            return MetricValue.unavailable();
        }
        if (totalVars == 0) {
            return MetricValue.notApplicable();
        }
        return MetricValue.of(Math.exp(-(double) outcome.filteredCount() / totalVars * NORMALIZATION_FACTOR));
    }
}
