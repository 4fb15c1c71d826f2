package com.raditha.typebench.model;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * One repository to evaluate: the unit of work handed to a worker.
 *
 * @param name           repository name, unique within a run
 * @param truthTree      fully annotated ground-truth source tree (read-only)
 * @param predictionTree source tree annotated with the predictions
 * @param baselineTree   untyped source tree the predictions were made for, may be null
 */
public record RepoTask(String name, Path truthTree, Path predictionTree, @Nullable Path baselineTree) {
}
