package com.raditha.typebench.consistency;

import com.raditha.typebench.config.CheckerConfig;
import com.raditha.typebench.model.Diagnostic;
import com.raditha.typebench.model.RepoTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs the type checker over the ground-truth and the prediction variant of a
 * repository and counts the relevant errors of each.
 * <p>
 * Each variant is checked in its own temporary copy. A failure of one variant
 * is reported as {@code unavailable} for that variant only.
 */
public class ConsistencyChecker {

    private static final Logger logger = LoggerFactory.getLogger(ConsistencyChecker.class);

    private final TypeChecker checker;
    private final DiagnosticParser parser;
    private final DiagnosticFilter filter;
    private final Duration timeout;

    public ConsistencyChecker(TypeChecker checker, CheckerConfig config) {
        this(checker, new DiagnosticParser(), new DiagnosticFilter(config), config.timeout());
    }

    public ConsistencyChecker(TypeChecker checker, DiagnosticParser parser, DiagnosticFilter filter,
                              Duration timeout) {
        this.checker = checker;
        this.parser = parser;
        this.filter = filter;
        this.timeout = timeout;
    }

    public ConsistencyReport check(RepoTask task) {
        CheckerOutcome truth = checkVariant(task.name(), task.truthTree(), "truth");
        CheckerOutcome prediction = checkVariant(task.name(), task.predictionTree(), "prediction");
        return new ConsistencyReport(truth, prediction);
    }

    /**
     * Check a single variant.
     *
     * @param repo    repository name
     * @param tree    variant tree, copied before checking
     * @param variant label used in logs and the temporary directory name
     */
    public CheckerOutcome checkVariant(String repo, Path tree, String variant) {
        try (VariantWorkspace workspace = VariantWorkspace.copyOf(tree, repo + "-" + variant)) {
            CheckerRun run = checker.check(repo, workspace.root(), timeout);
            List<Diagnostic> diagnostics = relativize(parser.parse(run.output()), workspace.root());
            int count = filter.count(diagnostics, workspace.root());
            logger.debug("{} {} variant: {} diagnostics, {} counted, exit code {} in {} ms",
                    repo, variant, diagnostics.size(), count, run.exitCode(), run.elapsed().toMillis());
            return CheckerOutcome.completed(diagnostics, count);
        } catch (CheckerUnavailableException e) {
            logger.warn("Checker unavailable for {} {} variant: {}", repo, variant, e.getMessage());
            return CheckerOutcome.unavailable(e.getMessage());
        } catch (IOException e) {
            logger.warn("Could not prepare {} {} variant for checking: {}", repo, variant, e.getMessage());
            return CheckerOutcome.unavailable("workspace: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.warn("Checking {} {} variant failed: {}", repo, variant, e.toString());
            return CheckerOutcome.unavailable("checker: " + e);
        }
    }

    /**
     * Rewrite absolute paths inside the temporary copy as paths relative to it,
     * so stored diagnostics do not depend on where the copy lived.
     */
    private static List<Diagnostic> relativize(List<Diagnostic> diagnostics, Path root) {
        return diagnostics.stream().map(d -> {
            Path file = Path.of(d.file());
            if (!file.isAbsolute() || !file.normalize().startsWith(root)) {
                return d;
            }
            String relative = root.relativize(file.normalize()).toString().replace('\\', '/');
            return new Diagnostic(relative, d.line(), d.column(), d.severity(), d.message(), d.code());
        }).toList();
    }
}
