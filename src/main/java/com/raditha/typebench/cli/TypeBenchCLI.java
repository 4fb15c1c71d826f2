package com.raditha.typebench.cli;

import com.raditha.typebench.config.CheckerConfig;
import com.raditha.typebench.config.ConfigLoader;
import com.raditha.typebench.config.EvaluationConfig;
import com.raditha.typebench.config.EvaluationSettings;
import com.raditha.typebench.consistency.ProcessTypeChecker;
import com.raditha.typebench.consistency.TypeChecker;
import com.raditha.typebench.metrics.RepoResult;
import com.raditha.typebench.metrics.ResultExporter;
import com.raditha.typebench.metrics.ScoreAggregator;
import com.raditha.typebench.model.RepoTask;
import com.raditha.typebench.model.ScoreRecord;
import com.raditha.typebench.workflow.EvaluationOrchestrator;
import com.raditha.typebench.workflow.EvaluationSummary;
import com.raditha.typebench.workflow.RepoEvaluation;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Command-line interface for typebench.
 * <p>
 * Usage:
 * java -jar typebench.jar --data-path &lt;dir&gt; --pred-path &lt;dir&gt; [options]
 * <p>
 * Expected layout: {@code <data>/<repo>/original_repo} holds the ground truth,
 * the optional {@code <data>/<repo>/repo_without_types} the untyped baseline,
 * and {@code <pred>/<repo>/} the tree annotated with the predictions.
 * <p>
 * Configuration priority: CLI arguments > typebench.yml > defaults
 */
@Command(name = "typebench", mixinStandardHelpOptions = true, version = "typebench v1.0.0",
        description = "Scores predicted type annotations against ground truth and type-checker consistency")
public class TypeBenchCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(TypeBenchCLI.class);

    static final String TRUTH_DIR = "original_repo";
    static final String BASELINE_DIR = "repo_without_types";

    @Option(names = "--data-path", required = true, description = "Directory of ground-truth repositories",
            paramLabel = "<dir>")
    private Path dataPath;

    @Option(names = "--pred-path", required = true, description = "Directory of prediction-annotated repositories",
            paramLabel = "<dir>")
    private Path predPath;

    @Option(names = "--num-workers", description = "Repositories evaluated in parallel (default: CPU count)",
            paramLabel = "<n>")
    private int numWorkers = 0; // 0 = use YAML/default

    @Option(names = "--repo", description = "Evaluate only this repository", paramLabel = "<name>")
    private String repo;

    @Option(names = "--config-file", description = "Use custom configuration file (default: ./typebench.yml)",
            paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--output", description = "Directory for the summary files (default: current directory)",
            paramLabel = "<dir>")
    private Path outputPath = Path.of(".");

    @Option(names = "--cache-dir", description = "Result cache directory (default: .typebench-cache)",
            paramLabel = "<dir>")
    private Path cacheDir;

    @Option(names = "--timeout", description = "Checker timeout per variant in seconds (default: 600)",
            paramLabel = "<seconds>")
    private int timeoutSeconds = 0; // 0 = use YAML/default

    @Option(names = "--export", description = "Summary format: csv, json or both (default: csv)",
            paramLabel = "<format>", converter = ExportFormatConverter.class)
    private ExportFormat exportFormat = ExportFormat.CSV;

    @Option(names = "--verbose", description = "Print every variable that is not a perfect match")
    private boolean verbose = false;

    @Spec
    private CommandSpec spec;

    private final Function<CheckerConfig, TypeChecker> checkerFactory;

    public TypeBenchCLI() {
        this(ProcessTypeChecker::new);
    }

    /**
     * @param checkerFactory builds the type checker from the loaded checker settings
     */
    public TypeBenchCLI(Function<CheckerConfig, TypeChecker> checkerFactory) {
        this.checkerFactory = checkerFactory;
    }

    /**
     * Picocli call method - executes the evaluation.
     *
     * @return 0 when every requested repository produced a row, 1 otherwise
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        Map<String, Object> document = ConfigLoader.loadOrDefault(configFile);
        EvaluationConfig config = EvaluationSettings.loadConfig(document, numWorkers, timeoutSeconds, cacheDir);

        List<RepoTask> tasks = discoverTasks(dataPath, predPath, repo);
        if (tasks.isEmpty()) {
            out().println("No repositories to evaluate under " + predPath);
            return 0;
        }

        EvaluationOrchestrator orchestrator = new EvaluationOrchestrator(config, checkerFactory.apply(config.checker()));
        EvaluationSummary summary = orchestrator.evaluate(tasks);

        printSummary(summary);
        if (verbose) {
            printMismatches(summary);
        }
        export(summary, new ScoreAggregator(config).columns());

        return summary.evaluations().size() == tasks.size() ? 0 : 1;
    }

    public static void main(String[] args) {
        System.exit(createCommandLine(new TypeBenchCLI()).execute(args));
    }

    /**
     * Command line with the exit-code mapping installed: 2 for configuration
     * errors, 3 for I/O errors, 4 when interrupted, 1 for anything else.
     */
    public static CommandLine createCommandLine(TypeBenchCLI cli) {
        CommandLine cmd = new CommandLine(cli);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (!Files.isDirectory(dataPath)) {
            throw new IllegalArgumentException("Data path not found: " + dataPath);
        }
        if (!Files.isDirectory(predPath)) {
            throw new IllegalArgumentException("Prediction path not found: " + predPath);
        }
        if (numWorkers < 0) {
            throw new IllegalArgumentException("Number of workers must be positive, got: " + numWorkers);
        }
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeoutSeconds);
        }
        if (configFile != null && !Files.isRegularFile(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
        if (Files.exists(outputPath) && !Files.isDirectory(outputPath)) {
            throw new IllegalArgumentException("Output path exists but is not a directory: " + outputPath);
        }
    }

    /**
     * Pair prediction directories with their ground truth.
     *
     * @param only restrict to this repository, or null for all
     * @throws IllegalArgumentException if {@code only} names an unknown repository
     */
    static List<RepoTask> discoverTasks(Path dataPath, Path predPath, @Nullable String only) throws IOException {
        List<String> names = new ArrayList<>();
        if (only != null) {
            if (!Files.isDirectory(predPath.resolve(only))
                    || !Files.isDirectory(dataPath.resolve(only).resolve(TRUTH_DIR))) {
                throw new IllegalArgumentException("Unknown repository: " + only);
            }
            names.add(only);
        } else {
            try (Stream<Path> entries = Files.list(predPath)) {
                entries.filter(Files::isDirectory)
                        .map(p -> p.getFileName().toString())
                        .filter(name -> !name.startsWith("."))
                        .sorted()
                        .forEach(names::add);
            }
        }

        List<RepoTask> tasks = new ArrayList<>();
        for (String name : names) {
            Path truth = dataPath.resolve(name).resolve(TRUTH_DIR);
            if (!Files.isDirectory(truth)) {
                logger.warn("Skipping {}: no ground truth at {}", name, truth);
                continue;
            }
            Path baseline = dataPath.resolve(name).resolve(BASELINE_DIR);
            tasks.add(new RepoTask(name, truth, predPath.resolve(name),
                    Files.isDirectory(baseline) ? baseline : null));
        }
        return tasks;
    }

    private void printSummary(EvaluationSummary summary) {
        PrintWriter out = out();
        out.printf("Evaluated %d repositories (%d from cache, %d failed)%n",
                summary.evaluations().size(), summary.cacheHits(), summary.failureCount());
        out.printf("%-30s %10s %10s %10s %10s %12s %12s%n", "repo", "vars", "overall", "wo_missing",
                "missing", "repo_a", "repo_b");
        for (RepoResult row : summary.rows()) {
            out.printf("%-30s %10s %10s %10s %10s %12s %12s%n",
                    row.repo(),
                    row.get(ScoreAggregator.TOTAL_VARS),
                    row.get(ScoreAggregator.OVERALL),
                    row.get(ScoreAggregator.OVERALL_WO_MISSING),
                    row.get(ScoreAggregator.MISSING_RATIO),
                    row.get(ScoreAggregator.REPO_A_CONSISTENCY),
                    row.get(ScoreAggregator.REPO_B_CONSISTENCY));
            if (row.isFailure()) {
                out.printf("  failed: %s%n", row.failureReason());
            }
        }
        out.flush();
    }

    private void printMismatches(EvaluationSummary summary) {
        PrintWriter out = out();
        for (RepoEvaluation evaluation : summary.evaluations()) {
            for (ScoreRecord record : evaluation.records()) {
                if (record.similarity() < 1.0) {
                    out.printf(Locale.ROOT, "[%s] %s (%s <---> %s): %.4f%n",
                            evaluation.repo(),
                            record.variable(),
                            record.truthLabel(),
                            record.missing() ? "missing" : record.predictedLabel(),
                            record.similarity());
                }
            }
        }
        out.flush();
    }

    private void export(EvaluationSummary summary, List<String> columns) throws IOException {
        ResultExporter exporter = new ResultExporter();
        if (exportFormat.writesCsv()) {
            Path csv = exporter.exportToCsv(summary.rows(), columns, outputPath);
            out().println("CSV summary: " + csv);
        }
        if (exportFormat.writesJson()) {
            Path json = exporter.exportToJson(summary.rows(), outputPath);
            out().println("JSON summary: " + json);
        }
        out().flush();
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    public static class ExportFormatConverter implements ITypeConverter<ExportFormat> {
        @Override
        public ExportFormat convert(String value) throws Exception {
            return ExportFormat.fromString(value);
        }
    }
}
