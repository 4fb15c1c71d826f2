package com.raditha.typebench.consistency;

import com.raditha.typebench.config.CheckerConfig;
import com.raditha.typebench.model.RepoTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ConsistencyCheckerTest {

    @TempDir
    Path tempDir;

    private TypeChecker typeChecker;
    private ConsistencyChecker checker;
    private RepoTask task;

    @BeforeEach
    void setUp() throws IOException {
        typeChecker = mock(TypeChecker.class);
        checker = new ConsistencyChecker(typeChecker, CheckerConfig.defaults().withTimeout(Duration.ofSeconds(30)));

        Path truth = tempDir.resolve("truth");
        Path prediction = tempDir.resolve("prediction");
        Files.createDirectories(truth.resolve("pkg"));
        Files.createDirectories(prediction.resolve("pkg"));
        Files.writeString(truth.resolve("pkg/a.py"), "x: int = 1\n");
        Files.writeString(prediction.resolve("pkg/a.py"), "x: str = 1\n");
        task = new RepoTask("demo", truth, prediction, null);
    }

    @Test
    void testCountsFilteredErrorsPerVariant() throws Exception {
        when(typeChecker.check(eq("demo"), any(Path.class), any(Duration.class))).thenAnswer(invocation -> {
            Path root = invocation.getArgument(1);
            String source = Files.readString(root.resolve("pkg/a.py"));
            if (source.contains("str")) {
                return new CheckerRun(1, root.resolve("pkg/a.py") + ":1: error: Incompatible types in assignment"
                        + "  [assignment]\n"
                        + "pkg/a.py:1: note: see docs\n", Duration.ofMillis(5));
            }
            return new CheckerRun(0, "", Duration.ofMillis(5));
        });

        ConsistencyReport report = checker.check(task);

        assertTrue(report.complete());
        assertEquals(0, report.truthOutcome().filteredCount());
        assertEquals(1, report.predictionOutcome().filteredCount());
        assertEquals(2, report.predictionOutcome().diagnostics().size());
        assertEquals("pkg/a.py", report.predictionOutcome().diagnostics().get(0).file(),
                "paths inside the temporary copy are stored relative to it");
    }

    @Test
    void testEachVariantRunsInItsOwnCopy() throws Exception {
        List<Path> roots = new ArrayList<>();
        when(typeChecker.check(any(), any(Path.class), any(Duration.class))).thenAnswer(invocation -> {
            Path root = invocation.getArgument(1);
            roots.add(root);
            assertTrue(Files.exists(root.resolve("pkg/a.py")));
            return new CheckerRun(0, "", Duration.ZERO);
        });

        checker.check(task);

        assertEquals(2, roots.size());
        assertNotEquals(roots.get(0), roots.get(1));
        for (Path root : roots) {
            assertFalse(root.startsWith(tempDir), "originals are never checked in place");
            assertFalse(Files.exists(root), "copies are removed afterwards");
        }
        verify(typeChecker, times(1)).check(eq("demo"), eq(roots.get(0)), eq(Duration.ofSeconds(30)));
    }

    @Test
    void testTimeoutOnOneVariantOnly() throws Exception {
        when(typeChecker.check(any(), any(Path.class), any(Duration.class)))
                .thenReturn(new CheckerRun(0, "", Duration.ZERO))
                .thenThrow(new CheckerUnavailableException("timed out after 30s"));

        ConsistencyReport report = checker.check(task);

        assertFalse(report.complete());
        assertTrue(report.truthOutcome().available());
        assertEquals(0, report.truthOutcome().filteredCount());
        assertFalse(report.predictionOutcome().available());
        assertEquals("timed out after 30s", report.predictionOutcome().reason());
        assertTrue(report.predictionOutcome().consistency().isUnavailable());
    }

    @Test
    void testOversizedLineNumberDoesNotSpoilTheVariant() throws Exception {
        when(typeChecker.check(any(), any(Path.class), any(Duration.class)))
                .thenReturn(new CheckerRun(1, "pkg/a.py:99999999999: error: boom [assignment]\n"
                        + "pkg/a.py:1: error: Incompatible types in assignment [assignment]\n", Duration.ZERO));

        CheckerOutcome outcome = checker.checkVariant("demo", task.predictionTree(), "prediction");

        assertTrue(outcome.available());
        assertEquals(1, outcome.filteredCount());
    }

    @Test
    void testUnexpectedCheckerFailureIsUnavailable() throws Exception {
        DiagnosticParser brokenParser = mock(DiagnosticParser.class);
        when(brokenParser.parse(any())).thenThrow(new IllegalStateException("bad output"));
        when(typeChecker.check(any(), any(Path.class), any(Duration.class)))
                .thenReturn(new CheckerRun(0, "whatever", Duration.ZERO));
        ConsistencyChecker fragile = new ConsistencyChecker(typeChecker, brokenParser,
                new DiagnosticFilter(CheckerConfig.defaults()), Duration.ofSeconds(30));

        ConsistencyReport report = fragile.check(task);

        assertFalse(report.truthOutcome().available());
        assertFalse(report.predictionOutcome().available());
        assertTrue(report.predictionOutcome().reason().contains("bad output"));
        assertTrue(report.predictionOutcome().consistency().isUnavailable());
    }

    @Test
    void testMissingTreeIsUnavailable() throws Exception {
        CheckerOutcome outcome = checker.checkVariant("demo", tempDir.resolve("absent"), "truth");

        assertFalse(outcome.available());
        assertTrue(outcome.reason().startsWith("workspace: "));
        verifyNoInteractions(typeChecker);
    }
}
