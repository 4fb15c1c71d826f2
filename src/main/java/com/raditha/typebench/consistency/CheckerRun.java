package com.raditha.typebench.consistency;

import java.time.Duration;

/**
 * A completed checker invocation.
 *
 * @param exitCode process exit code
 * @param output   combined stdout and stderr
 * @param elapsed  wall-clock time taken
 */
public record CheckerRun(int exitCode, String output, Duration elapsed) {
}
