package com.raditha.typebench.config;

import com.raditha.typebench.metrics.ScoreAggregator;
import com.raditha.typebench.model.ConstructorKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationConfigTest {

    @Test
    void testThresholdsAreSortedAndDeduplicated() {
        EvaluationConfig config = new EvaluationConfig(1, CheckerConfig.defaults(), SimilarityPolicy.defaults(),
                List.of(10, 5, 10), 5, null);

        assertEquals(List.of(5, 10), config.frequencyThresholds());
        assertEquals(EvaluationConfig.DEFAULT_CACHE_DIR, config.cacheDir());
    }

    @Test
    void testStandardColumnsCannotBeConfiguredAway() {
        CheckerConfig checker = CheckerConfig.defaults();
        SimilarityPolicy policy = SimilarityPolicy.defaults();

        EvaluationConfig extended = new EvaluationConfig(1, checker, policy, List.of(4), 7, null);
        assertEquals(List.of(4, 5, 10), extended.frequencyThresholds());
        assertEquals(List.of(5, 10), new EvaluationConfig(1, checker, policy, null, 5, null).frequencyThresholds());

        assertThrows(IllegalArgumentException.class,
                () -> new EvaluationConfig(1, checker, policy, List.of(5), 4, null));

        List<String> columns = new ScoreAggregator(extended).columns();
        for (int d = 1; d <= 5; d++) {
            assertTrue(columns.contains(ScoreAggregator.depthColumn(d, false)));
            assertTrue(columns.contains(ScoreAggregator.depthColumn(d, true)));
        }
        assertTrue(columns.contains(ScoreAggregator.lowerThanColumn(5, false)));
        assertTrue(columns.contains(ScoreAggregator.lowerThanColumn(10, true)));
    }

    @Test
    void testValidation() {
        CheckerConfig checker = CheckerConfig.defaults();
        SimilarityPolicy policy = SimilarityPolicy.defaults();
        assertThrows(IllegalArgumentException.class,
                () -> new EvaluationConfig(0, checker, policy, List.of(5), 5, null));
        assertThrows(IllegalArgumentException.class,
                () -> new EvaluationConfig(1, checker, policy, List.of(0), 5, null));
        assertThrows(IllegalArgumentException.class,
                () -> new EvaluationConfig(1, checker, policy, List.of(5), 0, null));
        assertThrows(IllegalArgumentException.class,
                () -> new EvaluationConfig(1, null, policy, List.of(5), 5, null));
    }

    @Test
    void testWithers() {
        EvaluationConfig config = EvaluationConfig.defaults().withNumWorkers(3).withCacheDir(Path.of("c"));
        assertEquals(3, config.numWorkers());
        assertEquals(Path.of("c"), config.cacheDir());
        assertEquals(SimilarityPolicy.defaults(), config.similarity());
    }

    @Test
    void testCheckerValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CheckerConfig(List.of(), Duration.ofSeconds(1),
                null, Set.of(0), Set.of(), ""));
        assertThrows(IllegalArgumentException.class, () -> new CheckerConfig(List.of("mypy"), Duration.ZERO,
                null, Set.of(0), Set.of(), ""));
        assertThrows(IllegalArgumentException.class, () -> new CheckerConfig(List.of("mypy"), Duration.ofSeconds(1),
                null, Set.of(), Set.of(), ""));
        assertEquals("", new CheckerConfig(List.of("mypy"), Duration.ofSeconds(1), null, Set.of(0), null, null)
                .keyword());
    }

    @Test
    void testPolicyFingerprintChangesWithOverrides() {
        SimilarityPolicy defaults = SimilarityPolicy.defaults();
        SimilarityPolicy tuned = defaults.withOverrides(0.5, 0.75, List.of(
                new SimilarityPolicy.AffinityRule(ConstructorKind.LIST,
                        ConstructorKind.SET, 0.2)));

        assertEquals(defaults.fingerprint(), SimilarityPolicy.defaults().fingerprint());
        assertNotEquals(defaults.fingerprint(), tuned.fingerprint());
        assertThrows(IllegalArgumentException.class, () -> new SimilarityPolicy(0.5, 1.2, List.of()));
    }
}
