package com.raditha.typebench.consistency;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Runs a static type checker over a source tree.
 * Implementations are synchronous and must be safe to call from several workers at once.
 */
public interface TypeChecker {

    /**
     * Check one tree.
     *
     * @param repo        repository name, used to select a per-repository environment
     * @param variantRoot tree to check; callers hand each invocation its own copy
     * @param timeout     wall-clock limit
     * @return the completed run
     * @throws CheckerUnavailableException on timeout, crash or missing environment
     */
    CheckerRun check(String repo, Path variantRoot, Duration timeout) throws CheckerUnavailableException;
}
