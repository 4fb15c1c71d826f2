package com.raditha.typebench.config;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * How the external type checker is invoked and which of its diagnostics count.
 *
 * @param command         command template, one element per argument; {@code ${repo}},
 *                        {@code ${path}} and {@code ${env}} are substituted per run
 * @param timeout         wall-clock limit for one checker run
 * @param environmentRoot directory holding one prepared environment per repository,
 *                        {@code null} when the command does not use {@code ${env}}
 * @param okExitCodes     exit codes of a checker run that completed (0 = clean, 1 = errors found)
 * @param keepCodes       error codes that always count toward consistency
 * @param keyword         message fragment that makes any other error count
 */
public record CheckerConfig(
        List<String> command,
        Duration timeout,
        @Nullable Path environmentRoot,
        Set<Integer> okExitCodes,
        Set<String> keepCodes,
        String keyword) {

    public static final List<String> DEFAULT_COMMAND = List.of(
            "mypy", "--no-incremental", "--show-error-codes", "--no-error-summary",
            "--hide-error-context", "${path}");

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(600);

    public static final Set<Integer> DEFAULT_OK_EXIT_CODES = Set.of(0, 1);

    public static final Set<String> DEFAULT_KEEP_CODES = Set.of(
            "attr-defined", "assignment", "arg-type", "union-attr", "index");

    public static final String DEFAULT_KEYWORD = "incompatible";

    public CheckerConfig {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("checker command cannot be empty");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("checker timeout must be positive");
        }
        if (okExitCodes == null || okExitCodes.isEmpty()) {
            throw new IllegalArgumentException("okExitCodes cannot be empty");
        }
        command = List.copyOf(command);
        okExitCodes = Set.copyOf(okExitCodes);
        keepCodes = keepCodes == null ? Set.of() : Set.copyOf(keepCodes);
        keyword = keyword == null ? "" : keyword;
    }

    /**
     * mypy with the error codes the consistency score is defined on.
     */
    public static CheckerConfig defaults() {
        return new CheckerConfig(DEFAULT_COMMAND, DEFAULT_TIMEOUT, null,
                DEFAULT_OK_EXIT_CODES, DEFAULT_KEEP_CODES, DEFAULT_KEYWORD);
    }

    public CheckerConfig withTimeout(Duration newTimeout) {
        return new CheckerConfig(command, newTimeout, environmentRoot, okExitCodes, keepCodes, keyword);
    }
}
