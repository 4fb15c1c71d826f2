package com.raditha.typebench.consistency;

import com.raditha.typebench.config.CheckerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the configured checker command as an external process.
 * <p>
 * Placeholders in the command template:
 * <ul>
 * <li>{@code ${path}}: absolute path of the tree to check</li>
 * <li>{@code ${repo}}: repository name</li>
 * <li>{@code ${env}}: the repository's prepared environment under the environment root</li>
 * </ul>
 * Output goes to a temporary file so that a checker producing a lot of output
 * never blocks while the timeout is being enforced.
 */
public class ProcessTypeChecker implements TypeChecker {

    private static final Logger logger = LoggerFactory.getLogger(ProcessTypeChecker.class);

    private static final long KILL_GRACE_SECONDS = 5;

    private final CheckerConfig config;

    public ProcessTypeChecker(CheckerConfig config) {
        this.config = config;
    }

    @Override
    public CheckerRun check(String repo, Path variantRoot, Duration timeout) throws CheckerUnavailableException {
        List<String> command = resolveCommand(repo, variantRoot);
        logger.debug("Running checker for {}: {}", repo, command);

        Path log;
        try {
            log = Files.createTempFile("typebench-checker-", ".log");
        } catch (IOException e) {
            throw new CheckerUnavailableException("cannot create checker output file: " + e.getMessage(), e);
        }

        long started = System.nanoTime();
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(variantRoot.toFile());
            pb.redirectErrorStream(true);
            pb.redirectOutput(log.toFile());

            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                throw new CheckerUnavailableException("cannot start checker '" + command.get(0) + "': "
                        + e.getMessage(), e);
            }

            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new CheckerUnavailableException("interrupted while waiting for checker", e);
            }
            if (!finished) {
                kill(process);
                throw new CheckerUnavailableException("timed out after " + timeout.toSeconds() + "s");
            }

            String output = readOutput(log);
            int exitCode = process.exitValue();
            if (!config.okExitCodes().contains(exitCode)) {
                throw new CheckerUnavailableException("checker crashed with exit code " + exitCode
                        + firstLine(output));
            }
            return new CheckerRun(exitCode, output, Duration.ofNanos(System.nanoTime() - started));
        } finally {
            try {
                Files.deleteIfExists(log);
            } catch (IOException e) {
                logger.warn("Could not delete checker output {}: {}", log, e.getMessage());
            }
        }
    }

    /**
     * Substitute the placeholders of the command template.
     *
     * @throws CheckerUnavailableException if {@code ${env}} is used and the environment does not exist
     */
    List<String> resolveCommand(String repo, Path variantRoot) throws CheckerUnavailableException {
        String path = variantRoot.toAbsolutePath().toString();
        List<String> resolved = new ArrayList<>();
        for (String part : config.command()) {
            String value = part.replace("${path}", path).replace("${repo}", repo);
            if (value.contains("${env}")) {
                value = value.replace("${env}", environmentFor(repo).toString());
            }
            resolved.add(value);
        }
        return resolved;
    }

    private Path environmentFor(String repo) throws CheckerUnavailableException {
        if (config.environmentRoot() == null) {
            throw new CheckerUnavailableException("command uses ${env} but no environment root is configured");
        }
        Path env = config.environmentRoot().resolve(repo).toAbsolutePath();
        if (!Files.isDirectory(env)) {
            throw new CheckerUnavailableException("no environment for " + repo + " at " + env);
        }
        return env;
    }

    private static void kill(Process process) {
        process.destroyForcibly();
        try {
            process.waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String readOutput(Path log) throws CheckerUnavailableException {
        try {
            return new String(Files.readAllBytes(log), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CheckerUnavailableException("cannot read checker output: " + e.getMessage(), e);
        }
    }

    private static String firstLine(String output) {
        String trimmed = output.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        int newline = trimmed.indexOf('\n');
        return ": " + (newline < 0 ? trimmed : trimmed.substring(0, newline));
    }
}
