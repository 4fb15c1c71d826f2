package com.raditha.typebench.workflow;

import com.raditha.typebench.analyzer.RepoAnalysis;
import com.raditha.typebench.analyzer.RepoAnalyzer;
import com.raditha.typebench.cache.CacheEntry;
import com.raditha.typebench.cache.PredictionHasher;
import com.raditha.typebench.cache.ResultCache;
import com.raditha.typebench.config.CheckerConfig;
import com.raditha.typebench.config.EvaluationConfig;
import com.raditha.typebench.consistency.ConsistencyChecker;
import com.raditha.typebench.consistency.ConsistencyReport;
import com.raditha.typebench.consistency.TypeChecker;
import com.raditha.typebench.metrics.RepoResult;
import com.raditha.typebench.metrics.ScoreAggregator;
import com.raditha.typebench.model.RepoTask;
import com.raditha.typebench.similarity.TypeSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Evaluates a batch of repositories on a fixed pool of workers.
 * <p>
 * Per repository: hash the prediction tree; on a cache hit reuse the stored
 * scores and checker outcomes; otherwise score the variables, run the checker
 * on both variants and store the entry. Either way the row is aggregated
 * afresh. A repository that cannot be read yields a failure row and the batch
 * carries on.
 */
public class EvaluationOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(EvaluationOrchestrator.class);

    private final int numWorkers;
    private final RepoAnalyzer analyzer;
    private final ConsistencyChecker consistencyChecker;
    private final ScoreAggregator aggregator;
    private final ResultCache cache;
    private final PredictionHasher hasher;

    public EvaluationOrchestrator(EvaluationConfig config, TypeChecker checker) {
        this(config.numWorkers(),
                new RepoAnalyzer(new TypeSimilarity(config.similarity())),
                new ConsistencyChecker(checker, config.checker()),
                new ScoreAggregator(config),
                new ResultCache(config.cacheDir()),
                new PredictionHasher(settingsFingerprint(config)));
    }

    public EvaluationOrchestrator(int numWorkers, RepoAnalyzer analyzer, ConsistencyChecker consistencyChecker,
                                  ScoreAggregator aggregator, ResultCache cache, PredictionHasher hasher) {
        if (numWorkers < 1) {
            throw new IllegalArgumentException("numWorkers must be >= 1");
        }
        this.numWorkers = numWorkers;
        this.analyzer = analyzer;
        this.consistencyChecker = consistencyChecker;
        this.aggregator = aggregator;
        this.cache = cache;
        this.hasher = hasher;
    }

    /**
     * Evaluate every task.
     *
     * @param tasks repositories to evaluate; names must be unique
     * @return one evaluation per task, sorted by repository name
     * @throws InterruptedException if interrupted while waiting for workers
     */
    public EvaluationSummary evaluate(List<RepoTask> tasks) throws InterruptedException {
        Set<String> names = new HashSet<>();
        for (RepoTask task : tasks) {
            if (!names.add(task.name())) {
                throw new IllegalArgumentException("Duplicate repository name: " + task.name());
            }
        }
        if (tasks.isEmpty()) {
            return new EvaluationSummary(List.of());
        }

        int workers = Math.min(numWorkers, tasks.size());
        logger.info("Evaluating {} repositories with {} workers", tasks.size(), workers);
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<RepoEvaluation>> futures = new ArrayList<>();
            for (RepoTask task : tasks) {
                futures.add(pool.submit(() -> evaluateRepo(task)));
            }
            List<RepoEvaluation> evaluations = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    evaluations.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    String repo = tasks.get(i).name();
                    logger.error("Worker for {} failed", repo, e.getCause());
                    evaluations.add(new RepoEvaluation(
                            aggregator.failure(repo, String.valueOf(e.getCause())), List.of(), false));
                }
            }
            return new EvaluationSummary(evaluations);
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Evaluate a single repository. Never throws; failures become a failure row.
     */
    public RepoEvaluation evaluateRepo(RepoTask task) {
        String repo = task.name();
        try {
            String hash = hasher.hash(task.predictionTree());
            Optional<CacheEntry> cached = cache.lookup(repo, hash);
            if (cached.isPresent()) {
                CacheEntry entry = cached.get();
                logger.info("{}: using cached result from {}", repo, entry.createdAt());
                RepoResult row = aggregator.aggregate(repo, entry.records(),
                        entry.truthOutcome(), entry.predictionOutcome());
                return new RepoEvaluation(row, entry.records(), true);
            }

            RepoAnalysis analysis = analyzer.analyze(task);
            ConsistencyReport consistency = consistencyChecker.check(task);
            CacheEntry entry = new CacheEntry(repo, hash, Instant.now(), analysis.records(),
                    consistency.truthOutcome(), consistency.predictionOutcome());
            try {
                cache.write(entry);
            } catch (IOException e) {
                logger.warn("{}: could not write cache entry: {}", repo, e.getMessage());
            }

            RepoResult row = aggregator.aggregate(repo, analysis.records(),
                    consistency.truthOutcome(), consistency.predictionOutcome());
            logger.info("{}: {} variables, {} missing, overall {}", repo, analysis.records().size(),
                    analysis.missingCount(), row.get(ScoreAggregator.OVERALL));
            return new RepoEvaluation(row, analysis.records(), false);
        } catch (IOException | RuntimeException e) {
            logger.error("{}: evaluation failed: {}", repo, e.getMessage());
            logger.debug("{}: failure detail", repo, e);
            return new RepoEvaluation(aggregator.failure(repo, e.getClass().getSimpleName() + ": " + e.getMessage()),
                    List.of(), false);
        }
    }

    /**
     * Text describing every setting that changes what a cache entry holds.
     */
    public static String settingsFingerprint(EvaluationConfig config) {
        CheckerConfig checker = config.checker();
        return config.similarity().fingerprint()
                + "|command=" + String.join(" ", checker.command())
                + "|ok=" + new TreeSet<>(checker.okExitCodes())
                + "|keep=" + new TreeSet<>(checker.keepCodes())
                + "|keyword=" + checker.keyword();
    }
}
