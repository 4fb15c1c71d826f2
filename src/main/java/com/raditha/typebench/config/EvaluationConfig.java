package com.raditha.typebench.config;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Configuration of an evaluation run.
 *
 * @param numWorkers          number of repositories evaluated concurrently
 * @param checker             external type checker settings
 * @param similarity          TypeSim policy
 * @param frequencyThresholds truth-label frequency cut-offs for the lower_than_k averages,
 *                            always including 5 and 10
 * @param maxDepth            deepest depth bucket, at least 5; deeper types are counted in it
 * @param cacheDir            root of the result cache
 */
public record EvaluationConfig(
        int numWorkers,
        CheckerConfig checker,
        SimilarityPolicy similarity,
        List<Integer> frequencyThresholds,
        int maxDepth,
        Path cacheDir) {

    public static final int DEFAULT_MAX_DEPTH = 5;

    public static final List<Integer> DEFAULT_FREQUENCY_THRESHOLDS = List.of(5, 10);

    public static final Path DEFAULT_CACHE_DIR = Path.of(".typebench-cache");

    /**
     * Validate configuration.
     */
    public EvaluationConfig {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("numWorkers must be >= 1");
        }
        if (checker == null) {
            throw new IllegalArgumentException("checker cannot be null");
        }
        if (similarity == null) {
            throw new IllegalArgumentException("similarity cannot be null");
        }
        if (maxDepth < DEFAULT_MAX_DEPTH) {
            throw new IllegalArgumentException("maxDepth must be >= " + DEFAULT_MAX_DEPTH + ", got " + maxDepth);
        }
        if (frequencyThresholds == null) {
            frequencyThresholds = List.of();
        }
        for (int threshold : frequencyThresholds) {
            if (threshold < 1) {
                throw new IllegalArgumentException("frequency thresholds must be >= 1, got " + threshold);
            }
        }
        frequencyThresholds = Stream.concat(DEFAULT_FREQUENCY_THRESHOLDS.stream(), frequencyThresholds.stream())
                .distinct().sorted().toList();
        if (cacheDir == null) {
            cacheDir = DEFAULT_CACHE_DIR;
        }
    }

    /**
     * One worker per available processor, mypy, the default TypeSim policy.
     */
    public static EvaluationConfig defaults() {
        return new EvaluationConfig(
                Math.max(1, Runtime.getRuntime().availableProcessors()),
                CheckerConfig.defaults(),
                SimilarityPolicy.defaults(),
                DEFAULT_FREQUENCY_THRESHOLDS,
                DEFAULT_MAX_DEPTH,
                DEFAULT_CACHE_DIR);
    }

    public EvaluationConfig withNumWorkers(int workers) {
        return new EvaluationConfig(workers, checker, similarity, frequencyThresholds, maxDepth, cacheDir);
    }

    public EvaluationConfig withCacheDir(Path dir) {
        return new EvaluationConfig(numWorkers, checker, similarity, frequencyThresholds, maxDepth, dir);
    }

    public EvaluationConfig withChecker(CheckerConfig checkerConfig) {
        return new EvaluationConfig(numWorkers, checkerConfig, similarity, frequencyThresholds, maxDepth, cacheDir);
    }
}
